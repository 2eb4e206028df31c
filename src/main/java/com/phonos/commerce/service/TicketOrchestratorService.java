package com.phonos.commerce.service;

import com.phonos.commerce.dto.ConfirmRequest;
import com.phonos.commerce.dto.ConfirmResponse;
import com.phonos.commerce.dto.CreateTicketRequest;
import com.phonos.commerce.dto.CreateTicketResponse;
import com.phonos.commerce.dto.DeliveryResponse;
import com.phonos.commerce.dto.OptionView;
import com.phonos.commerce.dto.OptionsResponse;
import com.phonos.commerce.dto.TicketStatusResponse;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.TicketNotFoundException;
import com.phonos.commerce.exception.TicketStateConflictException;
import com.phonos.commerce.exception.TicketValidationException;
import com.phonos.commerce.model.IntentClassification;
import com.phonos.commerce.model.LogisticsOrder;
import com.phonos.commerce.model.Product;
import com.phonos.commerce.model.ProductAlternative;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.Ticket;
import com.phonos.commerce.model.TicketStatus;
import com.phonos.commerce.model.WebDeal;
import com.phonos.commerce.model.WebDealResult;
import com.phonos.commerce.repository.LogisticsOrderRepository;
import com.phonos.commerce.repository.ProductRepository;
import com.phonos.commerce.repository.StoreCallRepository;
import com.phonos.commerce.repository.StoreRepository;
import com.phonos.commerce.repository.TicketRepository;
import com.phonos.commerce.repository.WebDealResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Entry point for the ticket API. Creates tickets and hands them to the pipeline, serves
 * snapshots and options from the database, and runs confirmation and delivery booking.
 */
@Service
public class TicketOrchestratorService {

    private static final Logger logger = LoggerFactory.getLogger(TicketOrchestratorService.class);

    static final int MIN_STORES = 1;
    static final int MAX_STORES = 10;

    private final TicketRepository ticketRepository;
    private final ProductRepository productRepository;
    private final StoreRepository storeRepository;
    private final StoreCallRepository storeCallRepository;
    private final WebDealResultRepository webDealResultRepository;
    private final LogisticsOrderRepository logisticsOrderRepository;
    private final TicketStateService ticketStateService;
    private final IntentClassifierService intentClassifierService;
    private final TicketPipelineService ticketPipelineService;
    private final OptionsAggregatorService optionsAggregatorService;
    private final LogisticsBookingService logisticsBookingService;
    private final Executor ticketPipelineExecutor;
    private final int defaultMaxStores;

    public TicketOrchestratorService(TicketRepository ticketRepository,
                                     ProductRepository productRepository,
                                     StoreRepository storeRepository,
                                     StoreCallRepository storeCallRepository,
                                     WebDealResultRepository webDealResultRepository,
                                     LogisticsOrderRepository logisticsOrderRepository,
                                     TicketStateService ticketStateService,
                                     IntentClassifierService intentClassifierService,
                                     TicketPipelineService ticketPipelineService,
                                     OptionsAggregatorService optionsAggregatorService,
                                     LogisticsBookingService logisticsBookingService,
                                     @Qualifier("ticketPipelineExecutor") Executor ticketPipelineExecutor,
                                     @Value("${app.ticket.default-max-stores:4}") int defaultMaxStores) {
        this.ticketRepository = ticketRepository;
        this.productRepository = productRepository;
        this.storeRepository = storeRepository;
        this.storeCallRepository = storeCallRepository;
        this.webDealResultRepository = webDealResultRepository;
        this.logisticsOrderRepository = logisticsOrderRepository;
        this.ticketStateService = ticketStateService;
        this.intentClassifierService = intentClassifierService;
        this.ticketPipelineService = ticketPipelineService;
        this.optionsAggregatorService = optionsAggregatorService;
        this.logisticsBookingService = logisticsBookingService;
        this.ticketPipelineExecutor = ticketPipelineExecutor;
        this.defaultMaxStores = defaultMaxStores;
    }

    /**
     * Validates and classifies a request. Order requests are persisted and processed in the
     * background; anything else is rejected without creating a ticket.
     *
     * @throws TicketValidationException when query, location or phone is blank, or the store
     *                                   count is out of range
     */
    public CreateTicketResponse create(CreateTicketRequest request) {
        String query = trimToNull(request.getQuery());
        String location = trimToNull(request.getLocation());
        String userPhone = trimToNull(request.getUserPhone());
        String userName = trimToNull(request.getUserName());
        int maxStores = request.getMaxStores() != null ? request.getMaxStores() : defaultMaxStores;

        if (query == null) {
            throw new TicketValidationException("query is required");
        }
        if (location == null) {
            throw new TicketValidationException("location is required");
        }
        if (userPhone == null) {
            throw new TicketValidationException("user_phone is required");
        }
        if (maxStores < MIN_STORES || maxStores > MAX_STORES) {
            throw new TicketValidationException("max_stores must be between " + MIN_STORES + " and " + MAX_STORES);
        }

        IntentClassification classification = intentClassifierService.classify(query);
        if (!classification.isOrder()) {
            logger.info("Rejected request classified as {}: '{}'", classification.intent().wireName(), query);
            return CreateTicketResponse.builder()
                    .status("rejected")
                    .message(StringUtils.hasText(classification.message()) ? classification.message()
                            : "This service can only find and order products from nearby stores.")
                    .intent(classification.intent().wireName())
                    .build();
        }

        Ticket ticket = new Ticket(query, location, userPhone, userName, maxStores);
        ticket.setQueryType(classification.intent().wireName());
        Ticket saved = ticketStateService.open(ticket,
                ticketId -> ticketPipelineExecutor.execute(() -> ticketPipelineService.run(ticketId)));
        return CreateTicketResponse.builder()
                .ticketId(saved.getId())
                .status("processing")
                .message("Looking for " + query + " near " + location + ". Poll the ticket for progress.")
                .build();
    }

    @Transactional(readOnly = true)
    public TicketStatusResponse getStatus(UUID ticketId) {
        Ticket ticket = findTicket(ticketId);
        List<Store> stores = storeRepository.findByTicketIdOrderByPriorityAscDiscoveryOrderAsc(ticketId);
        Map<Long, Store> storesById = stores.stream().collect(Collectors.toMap(Store::getId, Function.identity()));
        List<StoreCall> calls = storeCallRepository.findByTicketIdOrderByIdAsc(ticketId);

        return TicketStatusResponse.builder()
                .ticketId(ticket.getId())
                .status(ticket.getStatus().wireName())
                .queryType(ticket.getQueryType())
                .query(ticket.getQuery())
                .location(ticket.getLocation())
                .errorMessage(ticket.getErrorMessage())
                .result(ticket.getFinalResult())
                .confirmedStoreCallId(ticket.getConfirmedStoreCallId())
                .createdAt(ticket.getCreatedAt())
                .updatedAt(ticket.getUpdatedAt())
                .progress(progress(stores.size(), calls))
                .product(productRepository.findByTicketId(ticketId).map(this::toProductView).orElse(null))
                .stores(stores.stream().map(this::toStoreView).collect(Collectors.toList()))
                .storeCalls(calls.stream().map(c -> toStoreCallView(c, storesById.get(c.getStoreId())))
                        .collect(Collectors.toList()))
                .webDeals(webDealResultRepository.findById(ticketId).map(this::toWebDealsView).orElse(null))
                .delivery(logisticsOrderRepository.findFirstByTicketIdAndSupersededFalseOrderByIdDesc(ticketId)
                        .map(TicketOrchestratorService::toDeliveryResponse).orElse(null))
                .build();
    }

    /**
     * @throws TicketStateConflictException unless the ticket is {@link TicketStatus#COMPLETED}
     */
    @Transactional(readOnly = true)
    public OptionsResponse getOptions(UUID ticketId) {
        Ticket ticket = findTicket(ticketId);
        requireCompleted(ticket);
        List<StoreCall> calls = storeCallRepository.findByTicketIdOrderByIdAsc(ticketId);
        Map<Long, Store> storesById = storeRepository.findByTicketIdOrderByPriorityAscDiscoveryOrderAsc(ticketId)
                .stream().collect(Collectors.toMap(Store::getId, Function.identity()));
        String productName = productRepository.findByTicketId(ticketId).map(Product::getProductName).orElse(null);
        return optionsAggregatorService.aggregate(ticketId, ticket.getQuery(), productName, calls, storesById,
                webDealResultRepository.findById(ticketId));
    }

    /**
     * Accepts the requester's choice once and books delivery from the chosen store.
     */
    public ConfirmResponse confirm(UUID ticketId, ConfirmRequest request) {
        if (request == null || request.getStoreCallId() == null) {
            throw new TicketValidationException("store_call_id is required");
        }
        Ticket ticket = findTicket(ticketId);
        requireCompleted(ticket);
        if (ticket.isConfirmed()) {
            throw new TicketStateConflictException(ErrorCode.TICKET_ALREADY_CONFIRMED,
                    "Ticket was already confirmed for store call " + ticket.getConfirmedStoreCallId());
        }
        StoreCall storeCall = storeCallRepository.findById(request.getStoreCallId())
                .filter(call -> ticketId.equals(call.getTicketId()))
                .orElseThrow(() -> new TicketNotFoundException(ErrorCode.STORE_CALL_NOT_FOUND,
                        "Store call " + request.getStoreCallId() + " is not part of ticket " + ticketId));
        if (!storeCall.isAvailableOption()) {
            throw new TicketStateConflictException(ErrorCode.PRODUCT_NOT_AVAILABLE,
                    "Store call " + storeCall.getId() + " did not confirm the product as available");
        }
        String customerName = Optional.ofNullable(trimToNull(request.getCustomerName()))
                .orElse(trimToNull(ticket.getUserName()));
        if (customerName == null) {
            throw new TicketValidationException("customer_name is required when the ticket has no user_name");
        }
        Store store = storeRepository.findById(storeCall.getStoreId())
                .orElseThrow(() -> new TicketNotFoundException(ErrorCode.NOT_FOUND,
                        "Store " + storeCall.getStoreId() + " for store call " + storeCall.getId() + " is missing"));

        Ticket claimed = ticketStateService.claimConfirmation(ticketId, storeCall.getId());
        Product product = productRepository.findByTicketId(ticketId).orElse(null);
        LogisticsOrder order = logisticsBookingService.book(claimed, storeCall, store, product, customerName);

        return ConfirmResponse.builder()
                .ticketId(ticketId)
                .storeCallId(storeCall.getId())
                .status("confirmed")
                .message("Delivery booked from " + store.getName()
                        + (order.getLspName() != null ? " with " + order.getLspName() : "") + ".")
                .delivery(toDeliveryResponse(order))
                .build();
    }

    @Transactional(readOnly = true)
    public DeliveryResponse getDelivery(UUID ticketId) {
        findTicket(ticketId);
        return logisticsOrderRepository.findFirstByTicketIdAndSupersededFalseOrderByIdDesc(ticketId)
                .map(TicketOrchestratorService::toDeliveryResponse)
                .orElseThrow(() -> new TicketNotFoundException(ErrorCode.DELIVERY_NOT_FOUND,
                        "No delivery exists for ticket " + ticketId));
    }

    static TicketStatusResponse.Progress progress(int storesFound, List<StoreCall> calls) {
        int settled = (int) calls.stream().filter(c -> c.getStatus().isSettled()).count();
        return TicketStatusResponse.Progress.builder()
                .storesFound(storesFound)
                .callsTotal(calls.size())
                .callsCompleted(settled)
                .callsInProgress(calls.size() - settled)
                .build();
    }

    static DeliveryResponse toDeliveryResponse(LogisticsOrder order) {
        return DeliveryResponse.builder()
                .ticketId(order.getTicketId())
                .storeCallId(order.getStoreCallId())
                .state(order.getState().wireName())
                .providerState(order.getProviderState())
                .clientOrderId(order.getClientOrderId())
                .providerOrderId(order.getProviderOrderId())
                .pickupStoreName(order.getPickupStoreName())
                .pickupAddress(order.getPickupAddress())
                .dropAddress(order.getDropAddress())
                .customerName(order.getCustomerName())
                .lspName(order.getLspName())
                .quotedPrice(order.getQuotedPrice())
                .orderAmount(order.getOrderAmount())
                .riderName(order.getRiderName())
                .riderPhone(order.getRiderPhone())
                .trackingUrl(order.getTrackingUrl())
                .attempt(order.getAttempt())
                .errorMessage(order.getErrorMessage())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    private Ticket findTicket(UUID ticketId) {
        return ticketRepository.findById(ticketId).orElseThrow(() -> new TicketNotFoundException(ticketId));
    }

    private static void requireCompleted(Ticket ticket) {
        if (ticket.getStatus() != TicketStatus.COMPLETED) {
            throw new TicketStateConflictException(ErrorCode.TICKET_NOT_COMPLETED,
                    "Ticket is " + ticket.getStatus().wireName() + ", options are not ready");
        }
    }

    private TicketStatusResponse.ProductView toProductView(Product product) {
        List<Map<String, Object>> alternatives = product.getAlternatives() == null ? List.of()
                : product.getAlternatives().stream().map(TicketOrchestratorService::alternativeView)
                        .collect(Collectors.toList());
        return TicketStatusResponse.ProductView.builder()
                .productName(product.getProductName())
                .productCategory(product.getProductCategory())
                .specs(product.getSpecs())
                .alternatives(alternatives)
                .avgPriceOnline(product.getAvgPriceOnline())
                .storeSearchQuery(product.getStoreSearchQuery())
                .build();
    }

    private static Map<String, Object> alternativeView(ProductAlternative alternative) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", alternative.name());
        view.put("avg_price", alternative.avgPrice());
        view.put("reason", alternative.reason());
        return view;
    }

    private TicketStatusResponse.StoreView toStoreView(Store store) {
        return TicketStatusResponse.StoreView.builder()
                .storeId(store.getId())
                .name(store.getName())
                .address(store.getAddress())
                .phoneNumber(store.getPhoneNumber())
                .rating(store.getRating())
                .totalRatings(store.getTotalRatings())
                .priority(store.getPriority())
                .build();
    }

    private TicketStatusResponse.StoreCallView toStoreCallView(StoreCall call, Store store) {
        return TicketStatusResponse.StoreCallView.builder()
                .storeCallId(call.getId())
                .storeId(call.getStoreId())
                .storeName(store != null ? store.getName() : null)
                .status(call.getStatus().wireName())
                .endedReason(call.getEndedReason())
                .productAvailable(call.getProductAvailable())
                .matchedProduct(call.getMatchedProduct())
                .price(call.getPrice())
                .matchType(call.getMatchType() != null ? call.getMatchType().wireName() : null)
                .summary(call.getSummary())
                .build();
    }

    private TicketStatusResponse.WebDealsView toWebDealsView(WebDealResult result) {
        List<WebDeal> found = result.getDeals() == null ? List.of() : result.getDeals();
        List<OptionView> deals = IntStream.range(0, found.size())
                .mapToObj(i -> OptionsAggregatorService.fromDeal(i + 1, found.get(i)))
                .collect(Collectors.toList());
        return TicketStatusResponse.WebDealsView.builder()
                .status(result.getStatus().wireName())
                .searchSummary(result.getSearchSummary())
                .deals(deals)
                .completedAt(result.getCompletedAt())
                .build();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

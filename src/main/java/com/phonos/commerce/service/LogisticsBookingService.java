package com.phonos.commerce.service;

import com.phonos.commerce.exception.CommerceException;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.DeliveryQuote;
import com.phonos.commerce.model.DeliveryState;
import com.phonos.commerce.model.GeocodeResult;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import com.phonos.commerce.model.LogisticsOrder;
import com.phonos.commerce.model.Product;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.Ticket;
import com.phonos.commerce.repository.LogisticsOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Books delivery of a confirmed option and follows it through provider callbacks.
 *
 * <p>Booking geocodes the drop location, resolves the pickup pincode from the store, asks for
 * quotes, takes the cheapest partner and creates the order. Booking calls are never retried.
 * When a delivery partner cancels, the order is superseded and re-booked with the cheapest
 * partner that has not failed yet, up to {@code app.logistics.max-retries} times.
 */
@Service
public class LogisticsBookingService {

    private static final Logger logger = LoggerFactory.getLogger(LogisticsBookingService.class);
    private static final String UNKNOWN_PINCODE = "000000";
    static final String CALLBACK_PATH = "/api/logistics/callback";

    private final GoogleMapsClient googleMapsClient;
    private final ProRoutingClient proRoutingClient;
    private final LogisticsOrderStateService logisticsOrderStateService;
    private final LogisticsOrderRepository logisticsOrderRepository;
    private final Executor ticketPipelineExecutor;
    private final String callbackUrl;
    private final int maxRetries;
    private final BigDecimal maxOrderAmount;

    public LogisticsBookingService(GoogleMapsClient googleMapsClient,
                                   ProRoutingClient proRoutingClient,
                                   LogisticsOrderStateService logisticsOrderStateService,
                                   LogisticsOrderRepository logisticsOrderRepository,
                                   @Qualifier("ticketPipelineExecutor") Executor ticketPipelineExecutor,
                                   @Value("${app.logistics.callback-url:}") String callbackUrl,
                                   @Value("${app.logistics.max-retries:2}") int maxRetries,
                                   @Value("${app.logistics.max-order-amount:0}") BigDecimal maxOrderAmount) {
        this.googleMapsClient = googleMapsClient;
        this.proRoutingClient = proRoutingClient;
        this.logisticsOrderStateService = logisticsOrderStateService;
        this.logisticsOrderRepository = logisticsOrderRepository;
        this.ticketPipelineExecutor = ticketPipelineExecutor;
        this.callbackUrl = StringUtils.trimTrailingCharacter(callbackUrl, '/') + CALLBACK_PATH;
        this.maxRetries = maxRetries;
        this.maxOrderAmount = maxOrderAmount;
    }

    /**
     * Books delivery synchronously.
     *
     * @return the order in {@link DeliveryState#ORDER_PLACED} or later
     * @throws CommerceException after marking the order {@link DeliveryState#DELIVERY_FAILED}
     */
    public LogisticsOrder book(Ticket ticket, StoreCall storeCall, Store store, Product product, String customerName) {
        LogisticsOrder draft = new LogisticsOrder();
        draft.setTicketId(ticket.getId());
        draft.setStoreCallId(storeCall.getId());
        draft.setPickupStoreName(store.getName());
        draft.setPickupAddress(store.getAddress());
        draft.setPickupLat(store.getLatitude());
        draft.setPickupLng(store.getLongitude());
        draft.setPickupPhone(store.getPhoneNumber());
        draft.setDropAddress(ticket.getLocation());
        draft.setDropPhone(ticket.getUserPhone());
        draft.setCustomerName(customerName);
        draft.setItemName(storeCall.getMatchedProduct() != null ? storeCall.getMatchedProduct()
                : (product != null ? product.getProductName() : "Item"));
        draft.setOrderAmount(orderAmount(storeCall, product));
        LogisticsOrder order = logisticsOrderStateService.createPlacing(draft);
        logger.info("Booking delivery {} for ticket {} from {}", order.getClientOrderId(), ticket.getId(), store.getName());

        try {
            resolveAddresses(order);
            ProRoutingClient.QuoteResult quotes = proRoutingClient.getQuotes(order);
            DeliveryQuote cheapest = cheapest(quotes.quotes(), Set.of())
                    .orElseThrow(() -> new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                            "No delivery partners available for this route"));
            ProRoutingClient.CreatedOrder created = proRoutingClient.createOrder(order, cheapest, quotes.quoteId(), callbackUrl);
            return logisticsOrderStateService.markPlaced(order.getId(), created, cheapest, quotes.quoteId());
        } catch (CommerceException e) {
            logisticsOrderStateService.markFailed(order.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logisticsOrderStateService.markFailed(order.getId(), "Booking failed: " + e.getMessage());
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR, "Booking failed: " + e.getMessage(), e);
        }
    }

    /**
     * Applies a provider callback to the order it names. Unknown orders are ignored.
     */
    public void handleCallback(LogisticsCallbackEvent event) {
        Optional<LogisticsOrder> found = logisticsOrderRepository.findByProviderOrderId(event.providerOrderId());
        if (found.isEmpty()) {
            logger.info("Ignoring logistics callback {} for unknown order {}", event.eventId(), event.providerOrderId());
            return;
        }
        LogisticsOrder order = found.get();
        if (event.cancelledByPartner() && "Cancelled".equals(event.providerState())
                && !order.isSuperseded() && !order.getState().isTerminal()) {
            handlePartnerCancellation(order, event);
            return;
        }
        logisticsOrderStateService.applyCallback(order.getId(), event);
    }

    private void handlePartnerCancellation(LogisticsOrder order, LogisticsCallbackEvent event) {
        if (order.getAttempt() > maxRetries) {
            logger.warn("Ticket {}: delivery partner cancelled and {} retries are used up", order.getTicketId(), maxRetries);
            logisticsOrderStateService.applyCallback(order.getId(), event);
            return;
        }
        Set<String> failedPartners = failedPartners(order);
        Optional<LogisticsOrder> next = logisticsOrderStateService.supersedeForRetry(order.getId(), event);
        if (next.isEmpty()) {
            return;
        }
        logger.info("Ticket {}: partner {} cancelled ({}), re-booking as attempt {}", order.getTicketId(),
                order.getLspName(), event.cancellationReason(), next.get().getAttempt());
        ticketPipelineExecutor.execute(() -> rebook(next.get(), failedPartners));
    }

    void rebook(LogisticsOrder order, Set<String> excludedPartners) {
        try {
            ProRoutingClient.QuoteResult quotes = proRoutingClient.getQuotes(order);
            DeliveryQuote cheapest = cheapest(quotes.quotes(), excludedPartners)
                    .orElseThrow(() -> new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                            "No delivery partners left after excluding " + excludedPartners.size() + " failed partners"));
            ProRoutingClient.CreatedOrder created = proRoutingClient.createOrder(order, cheapest, quotes.quoteId(), callbackUrl);
            logisticsOrderStateService.markPlaced(order.getId(), created, cheapest, quotes.quoteId());
        } catch (RuntimeException e) {
            logger.warn("Re-booking delivery {} failed: {}", order.getClientOrderId(), e.getMessage());
            logisticsOrderStateService.markFailed(order.getId(), "Retry failed: " + e.getMessage());
        }
    }

    /**
     * Partners that already failed this ticket, including the one on the current order.
     */
    private Set<String> failedPartners(LogisticsOrder current) {
        Set<String> failed = logisticsOrderRepository.findByTicketIdOrderByIdAsc(current.getTicketId()).stream()
                .filter(LogisticsOrder::isSuperseded)
                .map(LogisticsOrder::getLspId)
                .filter(StringUtils::hasText)
                .collect(Collectors.toSet());
        if (StringUtils.hasText(current.getLspId())) {
            failed.add(current.getLspId());
        }
        return failed;
    }

    static Optional<DeliveryQuote> cheapest(List<DeliveryQuote> quotes, Set<String> excluded) {
        return quotes.stream()
                .filter(q -> !excluded.contains(q.lspId()))
                .min(Comparator.comparing(DeliveryQuote::price));
    }

    private void resolveAddresses(LogisticsOrder order) {
        GeocodeResult drop = googleMapsClient.geocode(order.getDropAddress())
                .orElseThrow(() -> new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                        "Could not geocode delivery location: " + order.getDropAddress()));
        order.setDropLat(drop.latitude());
        order.setDropLng(drop.longitude());
        order.setDropAddress(drop.formattedAddress());
        order.setDropPincode(drop.pincode() != null ? drop.pincode() : UNKNOWN_PINCODE);
        order.setDropCity(drop.city() != null ? drop.city() : lastSegment(order.getDropAddress()));
        order.setDropState(drop.state());

        if (order.getPickupLat() == null || order.getPickupLng() == null) {
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                    "Store " + order.getPickupStoreName() + " has no coordinates");
        }
        String pickupPincode = GoogleMapsClient.extractPincode(order.getPickupAddress())
                .or(() -> googleMapsClient.reverseGeocode(order.getPickupLat(), order.getPickupLng())
                        .map(GeocodeResult::pincode))
                .orElse(UNKNOWN_PINCODE);
        order.setPickupPincode(pickupPincode);
        logisticsOrderRepository.save(order);
    }

    private BigDecimal orderAmount(StoreCall storeCall, Product product) {
        BigDecimal amount = storeCall.getPrice();
        if (amount == null && product != null) {
            amount = product.getAvgPriceOnline();
        }
        if (amount == null) {
            amount = BigDecimal.ZERO;
        }
        if (maxOrderAmount != null && maxOrderAmount.signum() > 0 && amount.compareTo(maxOrderAmount) > 0) {
            return maxOrderAmount;
        }
        return amount;
    }

    private static String lastSegment(String address) {
        if (address == null) {
            return "";
        }
        String[] parts = address.split(",");
        return parts[parts.length - 1].trim();
    }
}

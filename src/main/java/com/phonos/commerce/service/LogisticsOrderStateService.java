package com.phonos.commerce.service;

import com.phonos.commerce.model.DeliveryQuote;
import com.phonos.commerce.model.DeliveryState;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import com.phonos.commerce.model.LogisticsOrder;
import com.phonos.commerce.repository.LogisticsOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

/**
 * All writes to {@link LogisticsOrder} rows, each under the row's lock. Delivery state only
 * moves forward; rider and tracking details are merged on every callback.
 */
@Service
public class LogisticsOrderStateService {

    private static final Logger logger = LoggerFactory.getLogger(LogisticsOrderStateService.class);

    private final LogisticsOrderRepository logisticsOrderRepository;

    public LogisticsOrderStateService(LogisticsOrderRepository logisticsOrderRepository) {
        this.logisticsOrderRepository = logisticsOrderRepository;
    }

    @Transactional
    public LogisticsOrder createPlacing(LogisticsOrder draft) {
        draft.setState(DeliveryState.PLACING_ORDER);
        if (draft.getClientOrderId() == null) {
            draft.setClientOrderId(newClientOrderId(draft.getTicketId()));
        }
        return logisticsOrderRepository.save(draft);
    }

    @Transactional
    public LogisticsOrder markPlaced(Long orderId, ProRoutingClient.CreatedOrder created, DeliveryQuote quote, String quoteId) {
        LogisticsOrder order = lock(orderId);
        order.setProviderOrderId(created.providerOrderId());
        order.setProviderState(created.providerState());
        order.setQuoteId(quoteId);
        order.setLspId(quote.lspId());
        order.setLspName(quote.lspName());
        order.setQuotedPrice(quote.price());
        if (StringUtils.hasText(created.trackingUrl())) {
            order.setTrackingUrl(created.trackingUrl());
        }
        DeliveryState target = DeliveryState.fromProviderState(created.providerState()).orElse(DeliveryState.ORDER_PLACED);
        order.advanceTo(target.ordinal() < DeliveryState.ORDER_PLACED.ordinal() ? DeliveryState.ORDER_PLACED : target);
        logger.info("Delivery {} for ticket {} placed with {} (provider order {}), state {}",
                order.getClientOrderId(), order.getTicketId(), quote.lspName(), created.providerOrderId(), order.getState());
        return order;
    }

    @Transactional
    public LogisticsOrder markFailed(Long orderId, String errorMessage) {
        LogisticsOrder order = lock(orderId);
        if (order.advanceTo(DeliveryState.DELIVERY_FAILED)) {
            order.setErrorMessage(errorMessage);
            logger.warn("Delivery {} for ticket {} failed: {}", order.getClientOrderId(), order.getTicketId(), errorMessage);
        }
        return order;
    }

    /**
     * Applies a provider callback. A state at or behind the current one changes nothing but the
     * rider and tracking details.
     *
     * @return the order after the update
     */
    @Transactional
    public LogisticsOrder applyCallback(Long orderId, LogisticsCallbackEvent event) {
        LogisticsOrder order = lock(orderId);
        mergeDetails(order, event);
        Optional<DeliveryState> target = DeliveryState.fromProviderState(event.providerState());
        if (target.isEmpty()) {
            logger.info("Delivery {}: unmapped provider state {}", order.getClientOrderId(), event.providerState());
            return order;
        }
        DeliveryState previous = order.getState();
        if (order.advanceTo(target.get())) {
            order.setProviderState(event.providerState());
            if (target.get() == DeliveryState.DELIVERY_FAILED) {
                order.setErrorMessage(event.cancellationReason() != null ? event.cancellationReason()
                        : "Provider reported " + event.providerState());
            }
            logger.info("Delivery {} (ticket {}): {} -> {}", order.getClientOrderId(), order.getTicketId(),
                    previous, order.getState());
        } else {
            logger.debug("Delivery {} ignored {} while {}", order.getClientOrderId(), event.providerState(), previous);
        }
        return order;
    }

    /**
     * Retires an order cancelled by its delivery partner and opens the next attempt in
     * {@link DeliveryState#PLACING_ORDER}, in one transaction so the ticket always has exactly
     * one current order.
     *
     * @return the new attempt, or empty when the old order is already terminal or superseded
     */
    @Transactional
    public Optional<LogisticsOrder> supersedeForRetry(Long orderId, LogisticsCallbackEvent event) {
        LogisticsOrder old = lock(orderId);
        if (old.isSuperseded() || old.getState().isTerminal()) {
            return Optional.empty();
        }
        mergeDetails(old, event);
        old.setProviderState(event.providerState());
        old.advanceTo(DeliveryState.DELIVERY_FAILED);
        old.setErrorMessage("Cancelled by delivery partner"
                + (event.cancellationReason() != null ? ": " + event.cancellationReason() : ""));
        old.setSuperseded(true);

        LogisticsOrder next = new LogisticsOrder();
        next.setTicketId(old.getTicketId());
        next.setStoreCallId(old.getStoreCallId());
        next.setClientOrderId(newClientOrderId(old.getTicketId()));
        next.setState(DeliveryState.PLACING_ORDER);
        next.setAttempt(old.getAttempt() + 1);
        next.setPickupAddress(old.getPickupAddress());
        next.setPickupLat(old.getPickupLat());
        next.setPickupLng(old.getPickupLng());
        next.setPickupPincode(old.getPickupPincode());
        next.setPickupPhone(old.getPickupPhone());
        next.setPickupStoreName(old.getPickupStoreName());
        next.setDropAddress(old.getDropAddress());
        next.setDropLat(old.getDropLat());
        next.setDropLng(old.getDropLng());
        next.setDropPincode(old.getDropPincode());
        next.setDropCity(old.getDropCity());
        next.setDropState(old.getDropState());
        next.setDropPhone(old.getDropPhone());
        next.setCustomerName(old.getCustomerName());
        next.setItemName(old.getItemName());
        next.setOrderAmount(old.getOrderAmount());
        return Optional.of(logisticsOrderRepository.save(next));
    }

    private void mergeDetails(LogisticsOrder order, LogisticsCallbackEvent event) {
        if (StringUtils.hasText(event.riderName())) {
            order.setRiderName(event.riderName());
        }
        if (StringUtils.hasText(event.riderPhone())) {
            order.setRiderPhone(event.riderPhone());
        }
        if (StringUtils.hasText(event.trackingUrl())) {
            order.setTrackingUrl(event.trackingUrl());
        }
    }

    private LogisticsOrder lock(Long orderId) {
        return logisticsOrderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new IllegalStateException("Logistics order " + orderId + " vanished"));
    }

    private static String newClientOrderId(UUID ticketId) {
        return ticketId + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}

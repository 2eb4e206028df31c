package com.phonos.commerce.model;

import java.util.Map;
import java.util.Optional;

/**
 * Delivery sub-state of a confirmed ticket, tracked on its {@link LogisticsOrder}.
 *
 * <p>{@link #AWAITING_CONFIRM} is the implicit state of a completed ticket before the user
 * confirms a store. It is never stored: no {@link LogisticsOrder} exists yet, so the delivery
 * endpoint answers 404 until confirmation. The first persisted state is {@link #PLACING_ORDER}.
 */
public enum DeliveryState {
    AWAITING_CONFIRM,
    PLACING_ORDER,
    ORDER_PLACED,
    AGENT_ASSIGNED,
    OUT_FOR_DELIVERY,
    DELIVERED,
    DELIVERY_FAILED;

    private static final Map<String, DeliveryState> PROVIDER_STATES = Map.ofEntries(
            Map.entry("UnFulfilled", ORDER_PLACED),
            Map.entry("Pending", ORDER_PLACED),
            Map.entry("Searching-for-Agent", ORDER_PLACED),
            Map.entry("Agent-assigned", AGENT_ASSIGNED),
            Map.entry("At-pickup", AGENT_ASSIGNED),
            Map.entry("Order-picked-up", OUT_FOR_DELIVERY),
            Map.entry("At-delivery", OUT_FOR_DELIVERY),
            Map.entry("Order-delivered", DELIVERED),
            Map.entry("Cancelled", DELIVERY_FAILED),
            Map.entry("RTO-Initiated", DELIVERY_FAILED),
            Map.entry("RTO-Delivered", DELIVERY_FAILED),
            Map.entry("RTO-Disposed", DELIVERY_FAILED)
    );

    public boolean isTerminal() {
        return this == DELIVERED || this == DELIVERY_FAILED;
    }

    public boolean canTransitionTo(DeliveryState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == DELIVERY_FAILED) {
            return true;
        }
        return next.ordinal() > this.ordinal();
    }

    /**
     * Maps a logistics-provider order state (e.g. {@code Agent-assigned}) to a delivery state.
     */
    public static Optional<DeliveryState> fromProviderState(String providerState) {
        if (providerState == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PROVIDER_STATES.get(providerState.trim()));
    }

    public String wireName() {
        return name().toLowerCase();
    }
}

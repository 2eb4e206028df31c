package com.phonos.commerce.model;

public record LogisticsCallbackEvent(
        String eventId,
        String providerOrderId,
        String providerState,
        String riderName,
        String riderPhone,
        String trackingUrl,
        boolean cancelledByPartner,
        String cancellationReason) {
}

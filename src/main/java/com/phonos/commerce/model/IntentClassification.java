package com.phonos.commerce.model;

/**
 * Outcome of classifying a free-text request.
 *
 * @param intent  classified intent
 * @param message short explanation suitable for showing to the requester on rejection
 */
public record IntentClassification(Intent intent, String message) {

    public boolean isOrder() {
        return intent == Intent.ORDER_PRODUCT;
    }
}

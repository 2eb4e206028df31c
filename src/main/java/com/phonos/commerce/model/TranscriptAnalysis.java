package com.phonos.commerce.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Structured facts extracted from a store call transcript. When {@code analyzable} is false
 * every other field is empty and the call settles as {@link StoreCallStatus#UNANALYZABLE}.
 */
public record TranscriptAnalysis(
        boolean analyzable,
        boolean productAvailable,
        String matchedProduct,
        BigDecimal price,
        MatchType matchType,
        Boolean deliveryAvailable,
        String deliveryEta,
        BigDecimal deliveryCharge,
        String deliveryMode,
        String summary,
        String notes,
        Map<String, Object> raw) {

    public static TranscriptAnalysis unanalyzable(String reason) {
        return new TranscriptAnalysis(false, false, null, null, MatchType.NONE, null, null, null, null,
                null, reason, Map.of("reason", reason));
    }
}

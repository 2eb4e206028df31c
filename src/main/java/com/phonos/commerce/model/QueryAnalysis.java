package com.phonos.commerce.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured reading of the request used to steer product research.
 */
public record QueryAnalysis(
        String queryType,
        String productCategory,
        String brandPreference,
        BigDecimal budgetMax,
        String urgency,
        String specificStore,
        List<String> keySpecs,
        String searchHint) {
}

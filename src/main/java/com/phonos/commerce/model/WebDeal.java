package com.phonos.commerce.model;

import java.math.BigDecimal;

/**
 * An online listing found by the web deal branch.
 */
public record WebDeal(
        String platform,
        String productTitle,
        BigDecimal price,
        BigDecimal originalPrice,
        Integer discountPercent,
        String url,
        String confidence,
        String deliveryEstimate,
        String angle) {
}

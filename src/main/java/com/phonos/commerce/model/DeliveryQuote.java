package com.phonos.commerce.model;

import java.math.BigDecimal;

/**
 * One logistics partner's offer from a quote request.
 */
public record DeliveryQuote(String lspId, String lspName, BigDecimal price, Integer pickupEtaMinutes) {
}

package com.phonos.commerce.model;

import java.math.BigDecimal;

public record ProductAlternative(String name, BigDecimal avgPrice, String reason) {
}

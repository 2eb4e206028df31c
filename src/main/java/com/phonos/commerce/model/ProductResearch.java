package com.phonos.commerce.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ProductResearch(
        String productName,
        String productCategory,
        Map<String, Object> specs,
        List<ProductAlternative> alternatives,
        BigDecimal avgPriceOnline,
        String storeSearchQuery,
        List<String> searchQueries,
        boolean specificStore) {

    public Product toProduct(UUID ticketId) {
        return Product.builder()
                .ticketId(ticketId)
                .productName(productName)
                .productCategory(productCategory)
                .specs(specs)
                .alternatives(alternatives)
                .avgPriceOnline(avgPriceOnline)
                .storeSearchQuery(storeSearchQuery)
                .searchQueries(searchQueries)
                .specificStore(specificStore)
                .build();
    }
}

package com.phonos.commerce.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only snapshot of a ticket, returned by GET /api/ticket/{id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketStatusResponse {

    private UUID ticketId;
    @Schema(example = "calling_stores")
    private String status;
    private String queryType;
    private String query;
    private String location;
    private String errorMessage;
    private Map<String, Object> result;
    private Long confirmedStoreCallId;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private Progress progress;
    private ProductView product;
    private List<StoreView> stores;
    private List<StoreCallView> storeCalls;
    private WebDealsView webDeals;
    private DeliveryResponse delivery;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Progress {
        private int storesFound;
        private int callsTotal;
        private int callsCompleted;
        private int callsInProgress;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ProductView {
        private String productName;
        private String productCategory;
        private Map<String, Object> specs;
        private List<Map<String, Object>> alternatives;
        private BigDecimal avgPriceOnline;
        private String storeSearchQuery;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StoreView {
        private Long storeId;
        private String name;
        private String address;
        private String phoneNumber;
        private Double rating;
        private Integer totalRatings;
        private Integer priority;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StoreCallView {
        private Long storeCallId;
        private Long storeId;
        private String storeName;
        private String status;
        private String endedReason;
        private Boolean productAvailable;
        private String matchedProduct;
        private BigDecimal price;
        private String matchType;
        private String summary;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class WebDealsView {
        private String status;
        private String searchSummary;
        private List<OptionView> deals;
        private OffsetDateTime completedAt;
    }
}

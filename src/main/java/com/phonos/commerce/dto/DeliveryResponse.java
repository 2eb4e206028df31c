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
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Current delivery for a confirmed ticket")
public class DeliveryResponse {
    private UUID ticketId;
    private Long storeCallId;
    @Schema(example = "agent_assigned")
    private String state;
    @Schema(description = "Raw state reported by the logistics provider", example = "Agent-assigned")
    private String providerState;
    private String clientOrderId;
    private String providerOrderId;
    private String pickupStoreName;
    private String pickupAddress;
    private String dropAddress;
    private String customerName;
    private String lspName;
    private BigDecimal quotedPrice;
    private BigDecimal orderAmount;
    private String riderName;
    private String riderPhone;
    private String trackingUrl;
    private Integer attempt;
    private String errorMessage;
    private OffsetDateTime updatedAt;
}

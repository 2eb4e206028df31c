package com.phonos.commerce.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "One purchasable option: a phoned store or an online listing")
public class OptionView {
    private int rank;
    @Schema(description = "store_call or web_deal")
    private String source;
    private boolean canConfirm;
    private Long storeCallId;
    private Long storeId;
    private String storeName;
    private String address;
    private String phoneNumber;
    private Double rating;
    private BigDecimal price;
    @Schema(description = "exact, alternative or none")
    private String matchType;
    private String matchedProduct;
    private Boolean deliveryAvailable;
    private String deliveryEta;
    private BigDecimal deliveryCharge;
    private String deliveryMode;
    private String summary;
    private String platform;
    private String url;
    private String confidence;
}

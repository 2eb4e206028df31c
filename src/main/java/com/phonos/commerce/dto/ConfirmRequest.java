package com.phonos.commerce.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConfirmRequest {

    @Schema(description = "Store call chosen from the options list", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long storeCallId;

    @Schema(description = "Recipient name; falls back to the name given at ticket creation")
    private String customerName;
}

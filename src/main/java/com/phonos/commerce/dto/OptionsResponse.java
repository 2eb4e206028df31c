package com.phonos.commerce.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OptionsResponse {
    private UUID ticketId;
    @Schema(description = "options_ready or rejected")
    private String status;
    @Schema(description = "Why no option can be confirmed: no_options or web_deals_only")
    private String reason;
    private boolean canConfirm;
    private String productName;
    private String message;
    private String quickVerdict;
    private List<OptionView> options;
}

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
@Schema(description = "A free-text product request plus where to deliver it")
public class CreateTicketRequest {

    @Schema(description = "What the requester wants", example = "a 20W USB-C charger", requiredMode = Schema.RequiredMode.REQUIRED)
    private String query;

    @Schema(description = "Delivery location", example = "HSR Layout, Bengaluru", requiredMode = Schema.RequiredMode.REQUIRED)
    private String location;

    @Schema(description = "Requester phone number", example = "+919800000000", requiredMode = Schema.RequiredMode.REQUIRED)
    private String userPhone;

    @Schema(description = "Requester name, used as the delivery recipient")
    private String userName;

    @Schema(description = "How many stores to call (1..10)", example = "4")
    private Integer maxStores;
}

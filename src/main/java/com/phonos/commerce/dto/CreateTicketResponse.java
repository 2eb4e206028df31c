package com.phonos.commerce.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateTicketResponse {

    @Schema(description = "Ticket id; null when the request was rejected")
    private UUID ticketId;

    @Schema(description = "processing or rejected", example = "processing")
    private String status;

    private String message;

    @Schema(description = "Classified intent, present on rejection", example = "wake_up_call")
    private String intent;
}

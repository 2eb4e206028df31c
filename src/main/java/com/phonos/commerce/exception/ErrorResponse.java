package com.phonos.commerce.exception;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;

@Schema(description = "Error payload returned for failed requests")
public record ErrorResponse(
        @Schema(description = "Outcome marker, always \"rejected\" for validation errors and \"error\" otherwise")
        String status,
        @Schema(description = "Stable error code", example = "T001")
        String code,
        @Schema(description = "Human-readable detail")
        String message,
        OffsetDateTime timestamp) {

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        String status = errorCode.getHttpStatus().value() == 400 ? "rejected" : "error";
        return new ErrorResponse(status, errorCode.getCode(), message, OffsetDateTime.now());
    }
}

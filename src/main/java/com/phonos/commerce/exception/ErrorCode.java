package com.phonos.commerce.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced to API clients, each bound to an HTTP status and a default message.
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "Invalid input."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C002", "Requested resource was not found."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C003", "Internal server error."),

    // Ticket (Txxx)
    TICKET_VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "T001", "Ticket request is invalid."),
    TICKET_NOT_FOUND(HttpStatus.NOT_FOUND, "T002", "Ticket not found."),
    TICKET_NOT_COMPLETED(HttpStatus.CONFLICT, "T003", "Ticket has not completed yet."),
    TICKET_ALREADY_CONFIRMED(HttpStatus.CONFLICT, "T004", "Ticket has already been confirmed."),
    STORE_CALL_NOT_FOUND(HttpStatus.NOT_FOUND, "T005", "Store call does not belong to this ticket."),
    PRODUCT_NOT_AVAILABLE(HttpStatus.CONFLICT, "T006", "Store did not confirm the product as available."),
    CALL_BATCH_ALREADY_STARTED(HttpStatus.CONFLICT, "T007", "Store calls were already started for this ticket."),
    DELIVERY_NOT_FOUND(HttpStatus.NOT_FOUND, "T008", "No delivery exists for this ticket."),

    // Upstream providers (Exxx)
    LLM_ERROR(HttpStatus.BAD_GATEWAY, "E001", "Language model request failed."),
    MAPS_ERROR(HttpStatus.BAD_GATEWAY, "E002", "Maps provider request failed."),
    VOICE_ERROR(HttpStatus.BAD_GATEWAY, "E003", "Voice provider request failed."),
    LOGISTICS_ERROR(HttpStatus.BAD_GATEWAY, "E004", "Delivery booking failed."),
    PROVIDER_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "E005", "Upstream provider timed out.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

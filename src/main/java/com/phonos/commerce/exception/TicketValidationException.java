package com.phonos.commerce.exception;

public class TicketValidationException extends CommerceException {
    public TicketValidationException(String detail) {
        super(ErrorCode.TICKET_VALIDATION_FAILED, detail);
    }
}

package com.phonos.commerce.exception;

public class TicketStateConflictException extends CommerceException {
    public TicketStateConflictException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}

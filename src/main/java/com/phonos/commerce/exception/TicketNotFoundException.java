package com.phonos.commerce.exception;

import java.util.UUID;

public class TicketNotFoundException extends CommerceException {
    public TicketNotFoundException(UUID ticketId) {
        super(ErrorCode.TICKET_NOT_FOUND, String.format("Ticket not found: ticketId=%s", ticketId));
    }

    public TicketNotFoundException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}

package org.example.ticketservice.exception;

import lombok.Getter;

/**
 * Exception thrown when a ticket is not found in the system.
 */
@Getter
public class TicketNotFoundException extends TicketingException {

    private static final String ERROR_CODE = "TICKET_NOT_FOUND";

    private final Long ticketId;

    public TicketNotFoundException(Long ticketId) {
        super("Ticket not found with id: " + ticketId, ERROR_CODE);
        this.ticketId = ticketId;
    }
}

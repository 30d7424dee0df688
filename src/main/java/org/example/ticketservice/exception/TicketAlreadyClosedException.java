package org.example.ticketservice.exception;

import lombok.Getter;

/**
 * Exception thrown when a mutation is attempted on a CLOSED ticket.
 */
@Getter
public class TicketAlreadyClosedException extends InvalidTicketOperationException {

    private static final String ERROR_CODE = "TICKET_ALREADY_CLOSED";

    private final Long ticketId;

    public TicketAlreadyClosedException(Long ticketId, String operation) {
        super("Cannot perform operation '" + operation + "': ticket " + ticketId + " is already closed",
                ERROR_CODE);
        this.ticketId = ticketId;
    }
}

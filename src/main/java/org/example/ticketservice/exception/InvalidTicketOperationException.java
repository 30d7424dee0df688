package org.example.ticketservice.exception;

/**
 * Base class for domain rule violations on an existing ticket.
 * The ticket is left unmodified whenever one of these is thrown.
 */
public abstract class InvalidTicketOperationException extends TicketingException {

    protected InvalidTicketOperationException(String message, String errorCode) {
        super(message, errorCode);
    }
}

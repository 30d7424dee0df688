package org.example.ticketservice.exception;

/**
 * Base exception class for all ticket-related exceptions.
 * Carries a stable error code that the web layer exposes to clients.
 */
public abstract class TicketingException extends RuntimeException {

    private final String errorCode;

    protected TicketingException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TicketingException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

package org.example.ticketservice.exception;

import lombok.Getter;

/**
 * Exception thrown when a requested status change is not an allowed edge
 * of the ticket state machine.
 */
@Getter
public class InvalidTicketTransitionException extends InvalidTicketOperationException {

    private static final String ERROR_CODE = "INVALID_TRANSITION";

    private final String from;
    private final String to;

    public InvalidTicketTransitionException(String from, String to) {
        this(from, to, ERROR_CODE);
    }

    protected InvalidTicketTransitionException(String from, String to, String errorCode) {
        super("Invalid transition from " + from + " to " + to, errorCode);
        this.from = from;
        this.to = to;
    }
}

package org.example.ticketservice.exception;

import lombok.Getter;

/**
 * Exception thrown when a requested status is not one of the known ticket statuses.
 */
@Getter
public class UnknownTicketStateException extends TicketingException {

    private static final String ERROR_CODE = "UNKNOWN_STATE";

    private final String requestedState;

    public UnknownTicketStateException(String requestedState) {
        super("Unknown ticket status: " + requestedState, ERROR_CODE);
        this.requestedState = requestedState;
    }
}

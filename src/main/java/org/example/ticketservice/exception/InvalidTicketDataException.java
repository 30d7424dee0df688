package org.example.ticketservice.exception;

import lombok.Getter;

/**
 * Exception thrown when caller input for a ticket is malformed:
 * blank title or description, response text out of bounds, unknown priority.
 */
@Getter
public class InvalidTicketDataException extends TicketingException {

    private static final String ERROR_CODE = "INVALID_DATA";

    /**
     * The field that failed validation.
     */
    private final String field;

    public InvalidTicketDataException(String field, String message) {
        super(message, ERROR_CODE);
        this.field = field;
    }
}

package org.example.ticketservice.exception;

/**
 * Exception thrown when an assigned priority would be reverted to Unassigned.
 */
public class InvalidPriorityTransitionException extends InvalidTicketTransitionException {

    private static final String ERROR_CODE = "INVALID_PRIORITY_TRANSITION";

    public InvalidPriorityTransitionException(String from, String to) {
        super(from, to, ERROR_CODE);
    }
}

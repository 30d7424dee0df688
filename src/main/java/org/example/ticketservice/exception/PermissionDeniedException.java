package org.example.ticketservice.exception;

import lombok.Getter;

/**
 * Exception thrown when the requester's role does not grant the attempted operation.
 */
@Getter
public class PermissionDeniedException extends InvalidTicketOperationException {

    private static final String ERROR_CODE = "PERMISSION_DENIED";

    private final String role;

    public PermissionDeniedException(String operation, String role) {
        super("Role " + role + " is not allowed to " + operation, ERROR_CODE);
        this.role = role;
    }
}

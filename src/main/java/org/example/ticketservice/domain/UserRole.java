package org.example.ticketservice.domain;

import java.util.Locale;

/**
 * Roles known to the ticket service. Permissions are expressed as
 * capabilities on the role instead of comparing role names.
 */
public enum UserRole {

    ADMIN,
    USER;

    public boolean canChangePriority() {
        return this == ADMIN;
    }

    public boolean canRespondToTickets() {
        return this == ADMIN;
    }

    /**
     * Resolves a role claim. Missing or unrecognised claims get the least privileged role.
     */
    public static UserRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        try {
            return UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return USER;
        }
    }
}

package org.example.ticketservice.domain;

import org.example.ticketservice.exception.UnknownTicketStateException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a ticket. CLOSED is terminal.
 */
public enum TicketStatus {

    OPEN,
    IN_PROGRESS,
    CLOSED;

    /** Status transition rules: current status to allowed next statuses */
    private static final Map<TicketStatus, Set<TicketStatus>> TRANSITIONS = Map.of(
            OPEN, Set.of(IN_PROGRESS),
            IN_PROGRESS, Set.of(CLOSED),
            CLOSED, Set.of()
    );

    public boolean canTransitionTo(TicketStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * Parses a status name, ignoring case and surrounding whitespace.
     *
     * @throws UnknownTicketStateException if the value names no status
     */
    public static TicketStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownTicketStateException(String.valueOf(value));
        }
        try {
            return TicketStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownTicketStateException(value);
        }
    }
}

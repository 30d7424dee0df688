package org.example.ticketservice.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import org.example.ticketservice.exception.InvalidTicketDataException;

import java.util.Arrays;

/**
 * Priority of a ticket. Every ticket starts UNASSIGNED; once a level is
 * assigned the ticket can move freely between levels but never back.
 */
public enum TicketPriority {

    UNASSIGNED("Unassigned"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    TicketPriority(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isAssigned() {
        return this != UNASSIGNED;
    }

    /**
     * Accepts either the label ({@code "High"}) or the constant name ({@code "HIGH"}), ignoring case.
     *
     * @throws InvalidTicketDataException if the value names no priority
     */
    public static TicketPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTicketDataException("priority", "Priority is required");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(p -> p.label.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new InvalidTicketDataException("priority",
                        "Unknown priority: " + value + ". Allowed: Unassigned, Low, Medium, High"));
    }
}

package org.example.ticketservice.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Base class for all ticket domain events published to other services.
 *
 * <p>Events are immutable and serialized as JSON with snake_case field names.
 * They are published only after the change they describe has been persisted.</p>
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class TicketEvent {

    public static final String SOURCE = "ticket-service";

    /**
     * Unique event ID for tracking and deduplication by consumers.
     */
    private final String eventId;

    /**
     * Event type identifier, e.g. {@code ticket.created}.
     */
    private final String eventType;

    /**
     * Timestamp when the event was created.
     */
    private final LocalDateTime timestamp;

    /**
     * Source service that generated the event.
     */
    private final String source;

    /**
     * The ticket this event is about.
     */
    private final Long ticketId;

    protected TicketEvent(String eventType, Long ticketId) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.timestamp = LocalDateTime.now();
        this.source = SOURCE;
        this.ticketId = ticketId;
    }
}

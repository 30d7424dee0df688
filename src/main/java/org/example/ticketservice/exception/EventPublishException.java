package org.example.ticketservice.exception;

import lombok.Getter;

import java.io.Serial;
import java.time.LocalDateTime;

/**
 * Exception thrown when a domain event could not be handed to the broker.
 * The state change that produced the event has already been persisted.
 */
@Getter
public class EventPublishException extends TicketingException {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final String ERROR_CODE = "EVENT_PUBLISH_FAILED";

    /**
     * Topic or exchange the event was addressed to.
     */
    private final String destination;

    /**
     * Event type identifier, e.g. {@code ticket.created}.
     */
    private final String eventType;

    /**
     * Message key (the ticket id).
     */
    private final String messageKey;

    private final LocalDateTime failureTimestamp;

    public EventPublishException(String message, String destination, String eventType,
                                 String messageKey, Throwable cause) {
        super(message, ERROR_CODE, cause);
        this.destination = destination;
        this.eventType = eventType;
        this.messageKey = messageKey;
        this.failureTimestamp = LocalDateTime.now();
    }

    /**
     * Gets a detailed error description.
     */
    public String getDetailedDescription() {
        return String.format(
                "[EventPublishError] Destination: %s, EventType: %s, Key: %s, Timestamp: %s - %s",
                destination, eventType, messageKey, failureTimestamp, getMessage()
        );
    }

    @Override
    public String toString() {
        return getDetailedDescription();
    }
}

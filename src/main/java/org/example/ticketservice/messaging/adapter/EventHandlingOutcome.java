package org.example.ticketservice.messaging.adapter;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * What the inbound adapter did with an event.
 * The consumer acknowledges PROCESSED and IGNORED events and discards DROPPED ones.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EventHandlingOutcome {

    public enum Kind {
        PROCESSED,
        IGNORED,
        DROPPED
    }

    public enum DropReason {
        MISSING_TICKET_ID,
        INVALID_TICKET_ID,
        TICKET_NOT_FOUND,
        PROCESSING_FAILED
    }

    private final Kind kind;
    private final String eventType;
    private final DropReason dropReason;
    private final String detail;

    public static EventHandlingOutcome processed(String eventType) {
        return new EventHandlingOutcome(Kind.PROCESSED, eventType, null, null);
    }

    public static EventHandlingOutcome ignored(String eventType) {
        return new EventHandlingOutcome(Kind.IGNORED, eventType, null, null);
    }

    public static EventHandlingOutcome dropped(String eventType, DropReason reason, String detail) {
        return new EventHandlingOutcome(Kind.DROPPED, eventType, reason, detail);
    }

    public boolean shouldAcknowledge() {
        return kind != Kind.DROPPED;
    }

    public Optional<DropReason> getDropReason() {
        return Optional.ofNullable(dropReason);
    }

    @Override
    public String toString() {
        return kind == Kind.DROPPED
                ? String.format("DROPPED[%s, %s: %s]", eventType, dropReason, detail)
                : String.format("%s[%s]", kind, eventType);
    }
}

package org.example.ticketservice.messaging.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.exception.TicketNotFoundException;
import org.example.ticketservice.messaging.adapter.EventHandlingOutcome.DropReason;
import org.example.ticketservice.usecase.DeleteTicketCommand;
import org.example.ticketservice.usecase.DeleteTicketUseCase;
import org.example.ticketservice.usecase.UseCaseResult;
import org.springframework.stereotype.Component;

/**
 * Translates events from the assignment service into ticket use cases.
 *
 * <p>The subscription is a fan-out stream carrying every service's events, so
 * anything other than {@code assignment.deleted} is ignored. Malformed payloads
 * and failed deletions are dropped: none of them would succeed on redelivery.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentEventAdapter implements InboundEventHandler {

    public static final String ASSIGNMENT_DELETED = "assignment.deleted";

    private static final String EVENT_TYPE_FIELD = "event_type";
    private static final String TICKET_ID_FIELD = "ticket_id";
    private static final String UNKNOWN_EVENT_TYPE = "unknown";

    private final DeleteTicketUseCase deleteTicketUseCase;

    @Override
    public EventHandlingOutcome handle(JsonNode event) {
        String eventType = event.path(EVENT_TYPE_FIELD).asText(UNKNOWN_EVENT_TYPE);

        if (ASSIGNMENT_DELETED.equals(eventType)) {
            return handleAssignmentDeleted(event);
        }
        log.debug("Ignoring event of type {}", eventType);
        return EventHandlingOutcome.ignored(eventType);
    }

    private EventHandlingOutcome handleAssignmentDeleted(JsonNode event) {
        JsonNode idNode = event.path(TICKET_ID_FIELD);

        if (idNode.isMissingNode() || idNode.isNull()
                || (idNode.isTextual() && idNode.asText().isBlank())) {
            log.warn("⚠️ {} event without ticket_id, dropping", ASSIGNMENT_DELETED);
            return EventHandlingOutcome.dropped(ASSIGNMENT_DELETED, DropReason.MISSING_TICKET_ID, "ticket_id missing");
        }

        Long ticketId = parseTicketId(idNode);
        if (ticketId == null) {
            log.warn("⚠️ Invalid ticket_id in {} event: {}", ASSIGNMENT_DELETED, idNode);
            return EventHandlingOutcome.dropped(ASSIGNMENT_DELETED, DropReason.INVALID_TICKET_ID, idNode.toString());
        }

        try {
            UseCaseResult<Long> result = deleteTicketUseCase.execute(new DeleteTicketCommand(ticketId));
            if (!result.isPublished()) {
                log.warn("⚠️ Ticket {} deleted by {} but the deletion event was not published",
                        ticketId, ASSIGNMENT_DELETED);
            } else {
                log.info("✅ Ticket {} deleted by {} event", ticketId, ASSIGNMENT_DELETED);
            }
            return EventHandlingOutcome.processed(ASSIGNMENT_DELETED);

        } catch (TicketNotFoundException e) {
            log.warn("⚠️ Ticket {} from {} event does not exist, dropping", ticketId, ASSIGNMENT_DELETED);
            return EventHandlingOutcome.dropped(ASSIGNMENT_DELETED, DropReason.TICKET_NOT_FOUND, e.getMessage());

        } catch (RuntimeException e) {
            log.error("❌ Error deleting ticket {} for {} event: {}", ticketId, ASSIGNMENT_DELETED, e.getMessage(), e);
            return EventHandlingOutcome.dropped(ASSIGNMENT_DELETED, DropReason.PROCESSING_FAILED, e.getMessage());
        }
    }

    /**
     * Accepts a JSON integer or a string holding a base-10 integer.
     *
     * @return the id, or null if the node holds anything else
     */
    private Long parseTicketId(JsonNode idNode) {
        if (idNode.isIntegralNumber() && idNode.canConvertToLong()) {
            return idNode.longValue();
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

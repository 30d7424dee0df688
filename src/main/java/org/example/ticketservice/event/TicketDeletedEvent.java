package org.example.ticketservice.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Event published when a ticket has been physically removed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketDeletedEvent extends TicketEvent {

    public static final String EVENT_TYPE = "ticket.deleted";

    public TicketDeletedEvent(Long ticketId) {
        super(EVENT_TYPE, ticketId);
    }

    @Override
    public String toString() {
        return String.format("TicketDeletedEvent[ticketId=%d]", getTicketId());
    }
}

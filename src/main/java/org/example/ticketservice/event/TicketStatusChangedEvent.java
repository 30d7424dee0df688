package org.example.ticketservice.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import org.example.ticketservice.domain.StatusChange;
import org.example.ticketservice.domain.TicketStatus;

/**
 * Event published when a ticket moved to a different status.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketStatusChangedEvent extends TicketEvent {

    public static final String EVENT_TYPE = "ticket.status_changed";

    private final TicketStatus oldStatus;
    private final TicketStatus newStatus;

    public TicketStatusChangedEvent(Long ticketId, TicketStatus oldStatus, TicketStatus newStatus) {
        super(EVENT_TYPE, ticketId);
        this.oldStatus = oldStatus;
        this.newStatus = newStatus;
    }

    public static TicketStatusChangedEvent from(Long ticketId, StatusChange change) {
        return new TicketStatusChangedEvent(ticketId, change.getOldStatus(), change.getNewStatus());
    }

    @Override
    public String toString() {
        return String.format("TicketStatusChangedEvent[ticketId=%d, %s -> %s]",
                getTicketId(), oldStatus, newStatus);
    }
}

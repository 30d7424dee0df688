package org.example.ticketservice.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import org.example.ticketservice.domain.PriorityChange;
import org.example.ticketservice.domain.TicketPriority;

/**
 * Event published when an administrator changed a ticket's priority.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketPriorityChangedEvent extends TicketEvent {

    public static final String EVENT_TYPE = "ticket.priority_changed";

    private final TicketPriority oldPriority;
    private final TicketPriority newPriority;
    private final String justification;

    public TicketPriorityChangedEvent(Long ticketId, TicketPriority oldPriority,
                                      TicketPriority newPriority, String justification) {
        super(EVENT_TYPE, ticketId);
        this.oldPriority = oldPriority;
        this.newPriority = newPriority;
        this.justification = justification;
    }

    public static TicketPriorityChangedEvent from(Long ticketId, PriorityChange change) {
        return new TicketPriorityChangedEvent(ticketId, change.getOldPriority(),
                change.getNewPriority(), change.getJustification());
    }

    @Override
    public String toString() {
        return String.format("TicketPriorityChangedEvent[ticketId=%d, %s -> %s]",
                getTicketId(), oldPriority.getLabel(), newPriority.getLabel());
    }
}

package org.example.ticketservice.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.TicketPriority;
import org.example.ticketservice.domain.TicketStatus;

/**
 * Event published when a new ticket has been created.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketCreatedEvent extends TicketEvent {

    public static final String EVENT_TYPE = "ticket.created";

    private final String title;
    private final String description;
    private final TicketStatus status;
    private final TicketPriority priority;
    private final String userId;

    public TicketCreatedEvent(Long ticketId, String title, String description,
                              TicketStatus status, TicketPriority priority, String userId) {
        super(EVENT_TYPE, ticketId);
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.userId = userId;
    }

    public static TicketCreatedEvent from(Ticket ticket) {
        return new TicketCreatedEvent(ticket.getId(), ticket.getTitle(), ticket.getDescription(),
                ticket.getStatus(), ticket.getPriority(), ticket.getUserId());
    }

    @Override
    public String toString() {
        return String.format("TicketCreatedEvent[ticketId=%d, status=%s]", getTicketId(), status);
    }
}

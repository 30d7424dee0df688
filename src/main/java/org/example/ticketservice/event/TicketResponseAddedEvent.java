package org.example.ticketservice.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import org.example.ticketservice.domain.AdminResponse;

/**
 * Event published when an administrator replied on a ticket.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketResponseAddedEvent extends TicketEvent {

    public static final String EVENT_TYPE = "ticket.response_added";

    private final Long responseId;
    private final String text;
    private final String adminId;

    public TicketResponseAddedEvent(Long ticketId, Long responseId, String text, String adminId) {
        super(EVENT_TYPE, ticketId);
        this.responseId = responseId;
        this.text = text;
        this.adminId = adminId;
    }

    public static TicketResponseAddedEvent from(Long ticketId, AdminResponse response) {
        return new TicketResponseAddedEvent(ticketId, response.getId(), response.getText(), response.getAdminId());
    }

    @Override
    public String toString() {
        return String.format("TicketResponseAddedEvent[ticketId=%d, responseId=%d, adminId=%s]",
                getTicketId(), responseId, adminId);
    }
}

package org.example.ticketservice.usecase;

import lombok.Value;
import org.example.ticketservice.domain.UserRole;

@Value
public class ChangeTicketPriorityCommand {
    Long ticketId;
    String newPriority;
    String justification;
    UserRole requesterRole;
}

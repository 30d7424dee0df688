package org.example.ticketservice.usecase;

import lombok.Value;
import org.example.ticketservice.domain.UserRole;

@Value
public class AddTicketResponseCommand {
    Long ticketId;
    String text;
    String adminId;
    UserRole requesterRole;
}

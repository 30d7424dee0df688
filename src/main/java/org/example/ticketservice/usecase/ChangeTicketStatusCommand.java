package org.example.ticketservice.usecase;

import lombok.Value;

@Value
public class ChangeTicketStatusCommand {
    Long ticketId;
    String newStatus;
}

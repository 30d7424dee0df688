package org.example.ticketservice.usecase;

import lombok.Value;

@Value
public class DeleteTicketCommand {
    Long ticketId;
}

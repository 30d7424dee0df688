package org.example.ticketservice.usecase;

import lombok.Value;

@Value
public class CreateTicketCommand {
    String title;
    String description;
    String userId;
}

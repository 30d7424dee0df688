package org.example.ticketservice.domain;

import lombok.Value;

/**
 * A status transition that actually happened.
 */
@Value
public class StatusChange {
    TicketStatus oldStatus;
    TicketStatus newStatus;
}

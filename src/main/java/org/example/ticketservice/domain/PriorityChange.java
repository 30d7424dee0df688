package org.example.ticketservice.domain;

import lombok.Value;

/**
 * A priority change that actually happened, with the justification given for it.
 */
@Value
public class PriorityChange {
    TicketPriority oldPriority;
    TicketPriority newPriority;
    String justification;
}

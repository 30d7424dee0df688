package org.example.ticketservice.event;

import org.example.ticketservice.exception.EventPublishException;

/**
 * Outbound messaging boundary for ticket domain events.
 */
public interface TicketEventPublisher {

    /**
     * Hands the event to the broker.
     *
     * @throws EventPublishException if the broker did not accept the event
     */
    void publish(TicketEvent event);
}

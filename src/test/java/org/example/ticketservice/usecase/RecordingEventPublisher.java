package org.example.ticketservice.usecase;

import org.example.ticketservice.event.TicketEvent;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.exception.EventPublishException;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every published event; can be switched into a failing broker.
 */
class RecordingEventPublisher implements TicketEventPublisher {

    private final List<TicketEvent> events = new ArrayList<>();
    private boolean failing;

    @Override
    public void publish(TicketEvent event) {
        if (failing) {
            throw new EventPublishException("broker unavailable", "ticket-events",
                    event.getEventType(), String.valueOf(event.getTicketId()), null);
        }
        events.add(event);
    }

    void failFromNowOn() {
        failing = true;
    }

    List<TicketEvent> getEvents() {
        return events;
    }

    List<String> getEventTypes() {
        return events.stream().map(TicketEvent::getEventType).toList();
    }
}

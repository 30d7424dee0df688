package org.example.ticketservice.messaging.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns a decoded inbound event into local work.
 */
@FunctionalInterface
public interface InboundEventHandler {

    EventHandlingOutcome handle(JsonNode event);
}

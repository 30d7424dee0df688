package org.example.ticketservice.messaging.consumer;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens a fresh broker session with the topology declared and consumption registered.
 */
@FunctionalInterface
public interface BrokerConnector {

    BrokerSession open() throws IOException, TimeoutException;
}

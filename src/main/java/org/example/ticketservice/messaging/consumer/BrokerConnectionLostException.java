package org.example.ticketservice.messaging.consumer;

import java.io.IOException;

/**
 * Signals that the broker connection went away while the consumer was waiting on it.
 */
public class BrokerConnectionLostException extends IOException {

    public BrokerConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.example.ticketservice.messaging.consumer;

/**
 * Connection lifecycle of the inbound event consumer.
 * DISCONNECTED → CONNECTING → CONSUMING → (DISCONNECTED on error | STOPPED on shutdown).
 */
public enum ConsumerState {
    DISCONNECTED,
    CONNECTING,
    CONSUMING,
    STOPPED
}

package org.example.ticketservice.messaging.consumer;

import java.time.Duration;

/**
 * Suspends the consumer thread between reconnect attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

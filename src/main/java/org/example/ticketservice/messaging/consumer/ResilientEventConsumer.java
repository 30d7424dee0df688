package org.example.ticketservice.messaging.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.messaging.adapter.EventHandlingOutcome;
import org.example.ticketservice.messaging.adapter.InboundEventHandler;
import org.springframework.context.SmartLifecycle;
import org.springframework.util.backoff.BackOffExecution;

import java.io.IOException;
import java.time.Duration;

/**
 * Long-running consumer of inbound integration events.
 *
 * <p>Each pass of the loop opens a {@link BrokerSession}, consumes from it one
 * message at a time and closes it when anything goes wrong. Between passes the
 * thread sleeps according to the {@link ReconnectBackoffPolicy}. The failure
 * counter and the backoff execution restart as soon as a session yields its
 * first delivery.</p>
 *
 * <p>Every delivery is settled exactly once: acknowledged when the handler
 * processed or ignored it, rejected without requeue when it could not be
 * decoded, was dropped, or made the handler throw. One bad message never stops
 * the stream.</p>
 */
@Slf4j
public class ResilientEventConsumer implements SmartLifecycle, Runnable {

    private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(10);

    private final BrokerConnector connector;
    private final InboundEventHandler handler;
    private final ObjectMapper objectMapper;
    private final ReconnectBackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final Duration stopJoinTimeout;

    private volatile boolean stopRequested;
    private volatile ConsumerState state = ConsumerState.DISCONNECTED;
    private volatile BrokerSession currentSession;
    private volatile Thread consumerThread;
    private int attempt;
    private BackOffExecution backOffExecution;

    public ResilientEventConsumer(BrokerConnector connector, InboundEventHandler handler,
                                  ObjectMapper objectMapper, ReconnectBackoffPolicy backoffPolicy,
                                  Sleeper sleeper) {
        this(connector, handler, objectMapper, backoffPolicy, sleeper, STOP_JOIN_TIMEOUT);
    }

    ResilientEventConsumer(BrokerConnector connector, InboundEventHandler handler,
                           ObjectMapper objectMapper, ReconnectBackoffPolicy backoffPolicy,
                           Sleeper sleeper, Duration stopJoinTimeout) {
        this.connector = connector;
        this.handler = handler;
        this.objectMapper = objectMapper;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.stopJoinTimeout = stopJoinTimeout;
        this.backOffExecution = backoffPolicy.start();
    }

    // ==================== Lifecycle ====================

    @Override
    public synchronized void start() {
        if (consumerThread != null) {
            if (consumerThread.isAlive()) {
                log.warn("⚠️ Inbound event consumer is still running, start ignored");
                return;
            }
            consumerThread = null;
        }
        stopRequested = false;
        Thread thread = new Thread(this, "ticket-event-consumer");
        thread.setDaemon(true);
        consumerThread = thread;
        thread.start();
        log.info("🚀 Inbound event consumer started");
    }

    /**
     * Stops the loop and waits for its thread. The thread reference is kept
     * while the old loop is still alive, so {@link #start()} never runs two loops.
     */
    @Override
    public void stop() {
        Thread thread = consumerThread;
        requestStop();
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(stopJoinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (this) {
            if (thread.isAlive()) {
                log.warn("⚠️ Inbound event consumer did not stop within {} ms", stopJoinTimeout.toMillis());
                return;
            }
            if (consumerThread == thread) {
                consumerThread = null;
            }
        }
        log.info("🛑 Inbound event consumer stopped");
    }

    @Override
    public boolean isRunning() {
        Thread thread = consumerThread;
        return thread != null && thread.isAlive();
    }

    /**
     * Asks the loop to finish after the message in hand. Closing the session
     * wakes a loop blocked waiting for deliveries.
     */
    public void requestStop() {
        stopRequested = true;
        BrokerSession session = currentSession;
        if (session != null) {
            session.close();
        }
    }

    public ConsumerState getState() {
        return state;
    }

    int getAttempt() {
        return attempt;
    }

    // ==================== Loop ====================

    @Override
    public void run() {
        while (!stopRequested) {
            BrokerSession session = null;
            try {
                state = ConsumerState.CONNECTING;
                session = connector.open();
                currentSession = session;
                if (stopRequested) {
                    break;
                }
                state = ConsumerState.CONSUMING;
                log.info("✅ Consuming inbound events");
                consume(session);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;

            } catch (Exception e) {
                if (stopRequested) {
                    break;
                }
                closeQuietly(session);
                session = null;
                state = ConsumerState.DISCONNECTED;

                attempt++;
                Duration delay = backoffPolicy.nextDelay(backOffExecution);
                log.warn("⚠️ Consumer connection failed (attempt {}): {}. Reconnecting in {} ms",
                        attempt, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            } finally {
                currentSession = null;
                closeQuietly(session);
            }
        }
        state = ConsumerState.STOPPED;
    }

    private void consume(BrokerSession session) throws IOException, InterruptedException {
        boolean firstDelivery = true;
        while (!stopRequested) {
            InboundDelivery delivery = session.nextDelivery();
            if (firstDelivery) {
                attempt = 0;
                backOffExecution = backoffPolicy.start();
                firstDelivery = false;
            }
            settle(session, delivery);
        }
    }

    /**
     * Decodes and dispatches one delivery, then acknowledges or rejects it.
     * Only broker I/O failures escape.
     */
    void settle(BrokerSession session, InboundDelivery delivery) throws IOException {
        long tag = delivery.getDeliveryTag();

        JsonNode event;
        try {
            event = objectMapper.readTree(delivery.getBody());
        } catch (IOException e) {
            log.error("❌ Undecodable message {} rejected: {}", tag, e.getMessage());
            session.nackWithoutRequeue(tag);
            return;
        }
        if (event == null || !event.isObject()) {
            log.error("❌ Message {} is not a JSON object, rejected", tag);
            session.nackWithoutRequeue(tag);
            return;
        }

        EventHandlingOutcome outcome;
        try {
            outcome = handler.handle(event);
        } catch (RuntimeException e) {
            log.error("❌ Handler failed on message {}: {}", tag, e.getMessage(), e);
            session.nackWithoutRequeue(tag);
            return;
        }

        if (outcome.shouldAcknowledge()) {
            log.debug("📥 Message {} settled as {}", tag, outcome);
            session.ack(tag);
        } else {
            log.warn("⚠️ Message {} rejected: {}", tag, outcome);
            session.nackWithoutRequeue(tag);
        }
    }

    private void closeQuietly(BrokerSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring failure while closing broker session: {}", e.getMessage());
        }
    }
}

package org.example.ticketservice.messaging.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.ticketservice.messaging.adapter.EventHandlingOutcome;
import org.example.ticketservice.messaging.adapter.EventHandlingOutcome.DropReason;
import org.example.ticketservice.messaging.adapter.InboundEventHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResilientEventConsumer Tests")
class ResilientEventConsumerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<String> handledTypes = new ArrayList<>();

    private final InboundEventHandler handler = event -> {
        String type = event.path("event_type").asText("unknown");
        handledTypes.add(type);
        switch (type) {
            case "explode":
                throw new IllegalStateException("handler bug");
            case "bad":
                return EventHandlingOutcome.dropped(type, DropReason.INVALID_TICKET_ID, "bad id");
            case "assignment.deleted":
                return EventHandlingOutcome.processed(type);
            default:
                return EventHandlingOutcome.ignored(type);
        }
    };

    private final ScriptedConnector connector = new ScriptedConnector();
    private ResilientEventConsumer consumer;

    private ResilientEventConsumer newConsumer() {
        consumer = new ResilientEventConsumer(connector, handler, objectMapper,
                ReconnectBackoffPolicy.defaults(), sleeps::add);
        return consumer;
    }

    @AfterEach
    void tearDown() {
        // clear any interrupt left on the test thread
        Thread.interrupted();
    }

    private static InboundDelivery delivery(long tag, String body) {
        return new InboundDelivery(tag, body.getBytes(StandardCharsets.UTF_8), false);
    }

    @Nested
    @DisplayName("Settling deliveries")
    class SettlingTests {

        @Test
        @DisplayName("Should reject an undecodable message and keep processing the following ones")
        void shouldRejectUndecodableMessage() {
            ScriptedSession session = new ScriptedSession(true,
                    delivery(1, "{not json"),
                    delivery(2, "{\"event_type\":\"assignment.deleted\",\"ticket_id\":42}"),
                    delivery(3, "{\"event_type\":\"assignment.created\"}"));
            connector.thenReturn(session);

            newConsumer().run();

            assertThat(session.nacked).containsExactly(1L);
            assertThat(session.acked).containsExactly(2L, 3L);
            assertThat(handledTypes).containsExactly("assignment.deleted", "assignment.created");
            assertThat(consumer.getState()).isEqualTo(ConsumerState.STOPPED);
        }

        @Test
        @DisplayName("Should reject JSON that is not an object")
        void shouldRejectNonObjectJson() {
            ScriptedSession session = new ScriptedSession(true,
                    delivery(1, "[1,2,3]"),
                    delivery(2, "42"));
            connector.thenReturn(session);

            newConsumer().run();

            assertThat(session.nacked).containsExactly(1L, 2L);
            assertThat(handledTypes).isEmpty();
        }

        @Test
        @DisplayName("Should reject dropped events and events that made the handler fail")
        void shouldRejectDroppedAndFailedEvents() {
            ScriptedSession session = new ScriptedSession(true,
                    delivery(1, "{\"event_type\":\"bad\"}"),
                    delivery(2, "{\"event_type\":\"explode\"}"),
                    delivery(3, "{\"event_type\":\"assignment.deleted\",\"ticket_id\":1}"));
            connector.thenReturn(session);

            newConsumer().run();

            assertThat(session.nacked).containsExactly(1L, 2L);
            assertThat(session.acked).containsExactly(3L);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Should settle every delivery exactly once")
        void shouldSettleExactlyOnce() {
            ScriptedSession session = new ScriptedSession(true,
                    delivery(1, "{\"event_type\":\"a\"}"),
                    delivery(2, "oops"),
                    delivery(3, "{\"event_type\":\"bad\"}"),
                    delivery(4, "{\"event_type\":\"assignment.deleted\",\"ticket_id\":1}"));
            connector.thenReturn(session);

            newConsumer().run();

            List<Long> settled = new ArrayList<>(session.acked);
            settled.addAll(session.nacked);
            assertThat(settled).containsExactlyInAnyOrder(1L, 2L, 3L, 4L);
        }
    }

    @Nested
    @DisplayName("Reconnecting")
    class ReconnectTests {

        @Test
        @DisplayName("Should wait 2s, 4s and 8s after three failed connection attempts")
        void shouldBackOffExponentially() {
            connector.thenFail().thenFail().thenFail()
                    .thenReturn(new ScriptedSession(true, delivery(1, "{\"event_type\":\"x\"}")));

            newConsumer().run();

            assertThat(sleeps).containsExactly(
                    Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8));
            assertThat(connector.openCalls).isEqualTo(4);
            assertThat(consumer.getAttempt()).isZero();
        }

        @Test
        @DisplayName("Should reset the backoff once a new session yields a delivery")
        void shouldResetBackoffAfterDelivery() {
            ScriptedSession dropping = new ScriptedSession(false, delivery(1, "{\"event_type\":\"x\"}"));
            ScriptedSession last = new ScriptedSession(true, delivery(1, "{\"event_type\":\"y\"}"));
            connector.thenFail().thenFail().thenReturn(dropping).thenReturn(last);

            newConsumer().run();

            assertThat(sleeps).containsExactly(
                    Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(2));
            assertThat(dropping.closed).isTrue();
            assertThat(dropping.acked).containsExactly(1L);
            assertThat(last.acked).containsExactly(1L);
        }

        @Test
        @DisplayName("Should stop when interrupted while waiting to reconnect")
        void shouldStopWhenInterruptedDuringBackoff() {
            connector.thenFail();
            consumer = new ResilientEventConsumer(connector, handler, objectMapper,
                    ReconnectBackoffPolicy.defaults(), duration -> {
                        throw new InterruptedException("shutdown");
                    });

            consumer.run();

            assertThat(consumer.getState()).isEqualTo(ConsumerState.STOPPED);
            assertThat(connector.openCalls).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should stop a consumer blocked waiting for deliveries")
        void shouldStopBlockedConsumer() throws Exception {
            BlockingSession session = new BlockingSession();
            connector.thenReturn(session);
            newConsumer();

            consumer.start();
            assertThat(session.waiting.poll(5, TimeUnit.SECONDS)).isTrue();
            assertThat(consumer.isRunning()).isTrue();
            assertThat(consumer.getState()).isEqualTo(ConsumerState.CONSUMING);

            consumer.stop();

            assertThat(consumer.isRunning()).isFalse();
            assertThat(consumer.getState()).isEqualTo(ConsumerState.STOPPED);
            assertThat(session.closed).isTrue();
        }

        @Test
        @DisplayName("Should not start a second loop while the old one is still shutting down")
        void shouldNotStartSecondLoopWhileOldOneIsAlive() throws Exception {
            StuckConnector stuck = new StuckConnector();
            consumer = new ResilientEventConsumer(stuck, handler, objectMapper,
                    ReconnectBackoffPolicy.defaults(), sleeps::add, Duration.ofMillis(50));

            consumer.start();
            assertThat(stuck.entered.await(5, TimeUnit.SECONDS)).isTrue();
            consumer.stop();

            assertThat(consumer.isRunning()).isTrue();
            consumer.start();
            assertThat(stuck.openCalls.get()).isEqualTo(1);

            stuck.release.countDown();
            long deadline = System.currentTimeMillis() + 5_000;
            while (consumer.isRunning() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThat(consumer.isRunning()).isFalse();
            assertThat(consumer.getState()).isEqualTo(ConsumerState.STOPPED);
            assertThat(stuck.openCalls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should tolerate stop before start")
        void shouldTolerateStopBeforeStart() {
            newConsumer().stop();

            assertThat(consumer.isRunning()).isFalse();
        }
    }

    // ==================== Fakes ====================

    private class ScriptedConnector implements BrokerConnector {

        private final Deque<BrokerSession> script = new ArrayDeque<>();
        private int openCalls;

        ScriptedConnector thenFail() {
            script.add(new FailingMarker());
            return this;
        }

        ScriptedConnector thenReturn(BrokerSession session) {
            script.add(session);
            return this;
        }

        @Override
        public BrokerSession open() throws IOException {
            openCalls++;
            BrokerSession next = script.poll();
            if (next == null || next instanceof FailingMarker) {
                throw new ConnectException("Connection refused");
            }
            if (next instanceof ScriptedSession) {
                ((ScriptedSession) next).owner = consumer;
            }
            return next;
        }
    }

    /**
     * Hangs in {@code open()} until released, ignoring interrupts like a blocked socket connect.
     */
    private static class StuckConnector implements BrokerConnector {

        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger openCalls = new AtomicInteger();

        @Override
        public BrokerSession open() throws IOException {
            openCalls.incrementAndGet();
            entered.countDown();
            boolean interrupted = false;
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            throw new ConnectException("Connection timed out");
        }
    }

    private static class FailingMarker extends ScriptedSession {
        FailingMarker() {
            super(false);
        }
    }

    /**
     * Replays its deliveries, then either asks the consumer to stop or reports a lost connection.
     */
    private static class ScriptedSession implements BrokerSession {

        private final Deque<InboundDelivery> deliveries;
        private final boolean stopWhenDrained;
        final List<Long> acked = new ArrayList<>();
        final List<Long> nacked = new ArrayList<>();
        ResilientEventConsumer owner;
        boolean closed;

        ScriptedSession(boolean stopWhenDrained, InboundDelivery... deliveries) {
            this.stopWhenDrained = stopWhenDrained;
            this.deliveries = new ArrayDeque<>(List.of(deliveries));
        }

        @Override
        public InboundDelivery nextDelivery() throws IOException {
            InboundDelivery next = deliveries.poll();
            if (next != null) {
                return next;
            }
            if (stopWhenDrained) {
                owner.requestStop();
            }
            throw new BrokerConnectionLostException("connection reset", null);
        }

        @Override
        public void ack(long deliveryTag) {
            acked.add(deliveryTag);
        }

        @Override
        public void nackWithoutRequeue(long deliveryTag) {
            nacked.add(deliveryTag);
        }

        @Override
        public boolean isOpen() {
            return !closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static class BlockingSession implements BrokerSession {

        private final BlockingQueue<InboundDelivery> deliveries = new LinkedBlockingQueue<>();
        final BlockingQueue<Boolean> waiting = new LinkedBlockingQueue<>();
        final List<Long> acked = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        @Override
        public InboundDelivery nextDelivery() throws InterruptedException {
            waiting.add(Boolean.TRUE);
            return deliveries.take();
        }

        @Override
        public void ack(long deliveryTag) {
            acked.add(deliveryTag);
        }

        @Override
        public void nackWithoutRequeue(long deliveryTag) {
        }

        @Override
        public boolean isOpen() {
            return !closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}

package org.example.ticketservice.messaging.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.MessageProperties;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.event.TicketEvent;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.exception.EventPublishException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

/**
 * Publishes ticket domain events to a durable RabbitMQ fan-out exchange.
 *
 * <p>The channel runs in publisher-confirm mode and every publish waits for the
 * broker confirm. A broken connection is dropped and reopened on the next publish.</p>
 */
@Slf4j
public class RabbitTicketEventPublisher implements TicketEventPublisher, AutoCloseable {

    private final ConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final String exchange;
    private final long confirmTimeoutMs;

    private Connection connection;
    private Channel channel;

    public RabbitTicketEventPublisher(ConnectionFactory connectionFactory, ObjectMapper objectMapper,
                                      String exchange, long confirmTimeoutMs) {
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.exchange = exchange;
        this.confirmTimeoutMs = confirmTimeoutMs;
    }

    @Override
    public synchronized void publish(TicketEvent event) {
        String key = String.valueOf(event.getTicketId());
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new EventPublishException("Event could not be serialized", exchange, event.getEventType(), key, e);
        }

        AMQP.BasicProperties properties = MessageProperties.PERSISTENT_TEXT_PLAIN.builder()
                .contentType("application/json")
                .contentEncoding(StandardCharsets.UTF_8.name())
                .messageId(event.getEventId())
                .type(event.getEventType())
                .build();

        log.info("📤 SENDING - {} - exchange: {}, key: {}, eventId: {}",
                event.getEventType(), exchange, key, event.getEventId());

        try {
            Channel ch = openChannel();
            ch.basicPublish(exchange, event.getEventType(), properties, body);
            ch.waitForConfirmsOrDie(confirmTimeoutMs);
            log.info("✅ SENT - {} - exchange: {}, key: {}", event.getEventType(), exchange, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while waiting for publisher confirm",
                    exchange, event.getEventType(), key, e);
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.error("❌ FAILED - {} - exchange: {}, key: {}, error: {}",
                    event.getEventType(), exchange, key, e.getMessage());
            resetConnection();
            throw new EventPublishException("RabbitMQ publish failed", exchange, event.getEventType(), key, e);
        }
    }

    private Channel openChannel() throws IOException, TimeoutException {
        if (channel != null && channel.isOpen()) {
            return channel;
        }
        resetConnection();
        connection = connectionFactory.newConnection("ticket-service-publisher");
        channel = connection.createChannel();
        channel.exchangeDeclare(exchange, BuiltinExchangeType.FANOUT, true);
        channel.confirmSelect();
        return channel;
    }

    private void resetConnection() {
        if (connection != null && connection.isOpen()) {
            try {
                connection.close();
            } catch (IOException | RuntimeException e) {
                log.debug("Ignoring failure while closing publisher connection: {}", e.getMessage());
            }
        }
        connection = null;
        channel = null;
    }

    @Override
    public synchronized void close() {
        resetConnection();
    }
}

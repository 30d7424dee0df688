package org.example.ticketservice.kafka.producer;

import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.event.TicketEvent;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.exception.EventPublishException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes ticket domain events to Kafka.
 *
 * <p>Events are keyed by ticket id so that all events of one ticket land on
 * the same partition and keep their order. The send is awaited so that the
 * calling use case learns about broker failures.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.events.publisher", havingValue = "kafka", matchIfMissing = true)
public class KafkaTicketEventPublisher implements TicketEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String ticketEventsTopic;
    private final long publishTimeoutMs;

    public KafkaTicketEventPublisher(
            KafkaTemplate<String, Object> kafkaTemplate,
            @Value("${app.kafka.topics.ticket-events:ticket-events}") String ticketEventsTopic,
            @Value("${app.kafka.publish-timeout-ms:5000}") long publishTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.ticketEventsTopic = ticketEventsTopic;
        this.publishTimeoutMs = publishTimeoutMs;
    }

    @Override
    public void publish(TicketEvent event) {
        String key = String.valueOf(event.getTicketId());

        log.info("📤 SENDING - {} - topic: {}, key: {}, eventId: {}",
                event.getEventType(), ticketEventsTopic, key, event.getEventId());

        try {
            SendResult<String, Object> result = kafkaTemplate.send(ticketEventsTopic, key, event)
                    .get(publishTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("✅ SENT - {} - topic: {}, partition: {}, offset: {}, key: {}",
                    event.getEventType(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    key);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing event",
                    ticketEventsTopic, event.getEventType(), key, e);
        } catch (ExecutionException e) {
            log.error("❌ FAILED - {} - topic: {}, key: {}, error: {}",
                    event.getEventType(), ticketEventsTopic, key, e.getCause().getMessage());
            throw new EventPublishException("Kafka rejected event",
                    ticketEventsTopic, event.getEventType(), key, e.getCause());
        } catch (TimeoutException e) {
            log.error("❌ TIMEOUT - {} - topic: {}, key: {}, waited {} ms",
                    event.getEventType(), ticketEventsTopic, key, publishTimeoutMs);
            throw new EventPublishException("Timed out waiting for Kafka acknowledgement",
                    ticketEventsTopic, event.getEventType(), key, e);
        } catch (RuntimeException e) {
            throw new EventPublishException("Kafka send failed",
                    ticketEventsTopic, event.getEventType(), key, e);
        }
    }
}

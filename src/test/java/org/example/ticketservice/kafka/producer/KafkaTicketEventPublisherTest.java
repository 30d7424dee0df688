package org.example.ticketservice.kafka.producer;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.example.ticketservice.event.TicketDeletedEvent;
import org.example.ticketservice.event.TicketEvent;
import org.example.ticketservice.exception.EventPublishException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaTicketEventPublisher Tests")
class KafkaTicketEventPublisherTest {

    private static final String TOPIC = "ticket-events";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaTicketEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new KafkaTicketEventPublisher(kafkaTemplate, TOPIC, 100);
    }

    @Test
    @DisplayName("Should send the event keyed by ticket id")
    void shouldSendKeyedByTicketId() {
        TicketEvent event = new TicketDeletedEvent(7L);
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 42L, 0, 0L, 1, 10);
        SendResult<String, Object> result = new SendResult<>(new ProducerRecord<>(TOPIC, "7", event), metadata);
        when(kafkaTemplate.send(TOPIC, "7", event)).thenReturn(CompletableFuture.completedFuture(result));

        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();

        verify(kafkaTemplate).send(TOPIC, "7", event);
    }

    @Test
    @DisplayName("Should surface broker rejections as EventPublishException")
    void shouldSurfaceRejection() {
        TicketEvent event = new TicketDeletedEvent(7L);
        when(kafkaTemplate.send(eq(TOPIC), eq("7"), any()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("not leader")));

        assertThatThrownBy(() -> publisher.publish(event))
                .isInstanceOf(EventPublishException.class)
                .hasCauseInstanceOf(KafkaException.class);
    }

    @Test
    @DisplayName("Should give up after the publish timeout")
    void shouldTimeOut() {
        TicketEvent event = new TicketDeletedEvent(7L);
        when(kafkaTemplate.send(eq(TOPIC), eq("7"), any())).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> publisher.publish(event))
                .isInstanceOf(EventPublishException.class)
                .hasCauseInstanceOf(TimeoutException.class)
                .hasMessageContaining("Timed out");
    }

    @Test
    @DisplayName("Should wrap synchronous send failures")
    void shouldWrapSynchronousFailures() {
        TicketEvent event = new TicketDeletedEvent(7L);
        when(kafkaTemplate.send(eq(TOPIC), eq("7"), any())).thenThrow(new KafkaException("producer closed"));

        assertThatThrownBy(() -> publisher.publish(event))
                .isInstanceOf(EventPublishException.class)
                .satisfies(e -> assertThat(((EventPublishException) e).getDestination()).isEqualTo(TOPIC));
    }
}

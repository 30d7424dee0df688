package org.example.ticketservice.messaging.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.example.ticketservice.config.JacksonConfig;
import org.example.ticketservice.event.TicketDeletedEvent;
import org.example.ticketservice.exception.EventPublishException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RabbitTicketEventPublisher Tests")
class RabbitTicketEventPublisherTest {

    private final ObjectMapper objectMapper = new JacksonConfig().eventObjectMapper();

    @Mock
    private ConnectionFactory connectionFactory;

    @Mock
    private Connection connection;

    @Mock
    private Channel channel;

    private RabbitTicketEventPublisher publisher;

    @BeforeEach
    void setUp() throws IOException, TimeoutException {
        when(connectionFactory.newConnection(anyString())).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        publisher = new RabbitTicketEventPublisher(connectionFactory, objectMapper, "tickets", 5000);
    }

    @Test
    @DisplayName("Should publish snake_case JSON routed by event type and wait for the confirm")
    void shouldPublishAndConfirm() throws Exception {
        publisher.publish(new TicketDeletedEvent(7L));

        verify(channel).exchangeDeclare("tickets", BuiltinExchangeType.FANOUT, true);
        verify(channel).confirmSelect();

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq("tickets"), eq("ticket.deleted"), props.capture(), body.capture());
        verify(channel).waitForConfirmsOrDie(5000);

        JsonNode json = objectMapper.readTree(body.getValue());
        assertThat(json.path("event_type").asText()).isEqualTo("ticket.deleted");
        assertThat(json.path("ticket_id").asLong()).isEqualTo(7L);
        assertThat(json.path("source").asText()).isEqualTo("ticket-service");
        assertThat(props.getValue().getDeliveryMode()).isEqualTo(2);
        assertThat(props.getValue().getContentType()).isEqualTo("application/json");
    }

    @Test
    @DisplayName("Should reuse the open channel across publishes")
    void shouldReuseChannel() throws Exception {
        when(channel.isOpen()).thenReturn(true);

        publisher.publish(new TicketDeletedEvent(1L));
        publisher.publish(new TicketDeletedEvent(2L));

        verify(connectionFactory, times(1)).newConnection(anyString());
    }

    @Test
    @DisplayName("Should report a missing confirm and drop the connection")
    void shouldReportMissingConfirm() throws Exception {
        doThrow(new IOException("nacked by broker")).when(channel).waitForConfirmsOrDie(anyLong());
        when(connection.isOpen()).thenReturn(true);

        assertThatThrownBy(() -> publisher.publish(new TicketDeletedEvent(7L)))
                .isInstanceOf(EventPublishException.class)
                .satisfies(e -> {
                    EventPublishException failure = (EventPublishException) e;
                    assertThat(failure.getDestination()).isEqualTo("tickets");
                    assertThat(failure.getEventType()).isEqualTo("ticket.deleted");
                    assertThat(failure.getMessageKey()).isEqualTo("7");
                });

        verify(connection).close();
    }
}

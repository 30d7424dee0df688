package org.example.ticketservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.messaging.adapter.AssignmentEventAdapter;
import org.example.ticketservice.messaging.consumer.RabbitBrokerConnector;
import org.example.ticketservice.messaging.consumer.ReconnectBackoffPolicy;
import org.example.ticketservice.messaging.consumer.ResilientEventConsumer;
import org.example.ticketservice.messaging.consumer.Sleeper;
import org.example.ticketservice.messaging.publisher.RabbitTicketEventPublisher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * RabbitMQ Configuration.
 * - Connection settings shared by the inbound consumer and the optional publisher
 * - Inbound: fan-out exchange bound to a durable queue, consumed with manual ack
 * - Reconnect backoff for the consumer loop
 *
 * The client's automatic recovery is disabled; {@link ResilientEventConsumer} owns reconnection.
 */
@Slf4j
@Configuration
public class RabbitMqConfig {

    @Value("${app.rabbitmq.host:localhost}")
    private String host;

    @Value("${app.rabbitmq.port:5672}")
    private int port;

    @Value("${app.rabbitmq.username:guest}")
    private String username;

    @Value("${app.rabbitmq.password:guest}")
    private String password;

    @Value("${app.rabbitmq.virtual-host:/}")
    private String virtualHost;

    @Value("${app.rabbitmq.heartbeat-seconds:30}")
    private int heartbeatSeconds;

    @Value("${app.rabbitmq.connection-timeout-ms:5000}")
    private int connectionTimeoutMs;

    @Value("${app.rabbitmq.exchange:tickets}")
    private String exchange;

    @Value("${app.rabbitmq.queue:tickets_queue}")
    private String queue;

    @Value("${app.rabbitmq.prefetch:1}")
    private int prefetch;

    // ==================== Connection ====================

    @Bean
    public ConnectionFactory rabbitConnectionFactory() {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(host);
        factory.setPort(port);
        factory.setUsername(username);
        factory.setPassword(password);
        factory.setVirtualHost(virtualHost);
        factory.setRequestedHeartbeat(heartbeatSeconds);
        factory.setConnectionTimeout(connectionTimeoutMs);
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    // ==================== Consumer ====================

    @Bean
    public ReconnectBackoffPolicy reconnectBackoffPolicy(
            @Value("${app.rabbitmq.reconnect.initial-delay-ms:1000}") long initialDelayMs,
            @Value("${app.rabbitmq.reconnect.backoff-factor:2.0}") double backoffFactor,
            @Value("${app.rabbitmq.reconnect.max-delay-ms:60000}") long maxDelayMs) {
        return new ReconnectBackoffPolicy(
                Duration.ofMillis(initialDelayMs), backoffFactor, Duration.ofMillis(maxDelayMs));
    }

    @Bean
    @ConditionalOnProperty(name = "app.rabbitmq.consumer.enabled", havingValue = "true", matchIfMissing = true)
    public ResilientEventConsumer assignmentEventConsumer(ConnectionFactory rabbitConnectionFactory,
                                                          AssignmentEventAdapter assignmentEventAdapter,
                                                          ObjectMapper eventObjectMapper,
                                                          ReconnectBackoffPolicy reconnectBackoffPolicy) {
        log.info("🐇 Inbound consumer on exchange '{}' queue '{}' (prefetch {})", exchange, queue, prefetch);
        RabbitBrokerConnector connector =
                new RabbitBrokerConnector(rabbitConnectionFactory, exchange, queue, prefetch);
        return new ResilientEventConsumer(connector, assignmentEventAdapter, eventObjectMapper,
                reconnectBackoffPolicy, Sleeper.THREAD_SLEEP);
    }

    // ==================== Publisher ====================

    /**
     * Outbound publisher used when {@code app.events.publisher=rabbit}.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "app.events.publisher", havingValue = "rabbit")
    public RabbitTicketEventPublisher rabbitTicketEventPublisher(
            ConnectionFactory rabbitConnectionFactory,
            ObjectMapper eventObjectMapper,
            @Value("${app.rabbitmq.publish-exchange:tickets}") String publishExchange,
            @Value("${app.rabbitmq.confirm-timeout-ms:5000}") long confirmTimeoutMs) {
        return new RabbitTicketEventPublisher(rabbitConnectionFactory, eventObjectMapper,
                publishExchange, confirmTimeoutMs);
    }
}

package org.example.ticketservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerde;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka Configuration for outbound ticket events.
 * - Configures the producer factory with JSON serialization
 * - Declares the ticket-events topic
 * - Reliable delivery: acks=all, idempotent producer
 *
 * The service does not consume from Kafka; inbound events arrive over RabbitMQ.
 */
@Configuration
@ConditionalOnProperty(name = "app.events.publisher", havingValue = "kafka", matchIfMissing = true)
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${app.kafka.topics.ticket-events:ticket-events}")
    private String ticketEventsTopic;

    @Value("${app.kafka.topics.partitions:3}")
    private int partitions;

    @Value("${app.kafka.topics.replicas:1}")
    private int replicas;

    @Value("${app.kafka.publish-timeout-ms:5000}")
    private int publishTimeoutMs;

    // ==================== Topics ====================

    /**
     * Topic for ticket domain events (created, status/priority changed, response added, deleted).
     */
    @Bean
    public NewTopic ticketEventsTopic() {
        return TopicBuilder.name(ticketEventsTopic)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }

    // ==================== Producer Configuration ====================

    /**
     * Producer configuration map.
     */
    @Bean
    public Map<String, Object> producerConfigs() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Reliability settings
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Math.max(publishTimeoutMs, 1000) + 1000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Math.max(publishTimeoutMs, 1000));
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, publishTimeoutMs);

        // Performance settings
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return props;
    }

    /**
     * Producer factory using JsonSerde without type headers; consumers are not Java services.
     */
    @Bean
    public ProducerFactory<String, Object> producerFactory(ObjectMapper eventObjectMapper) {
        JsonSerde<Object> jsonSerde = new JsonSerde<>(Object.class, eventObjectMapper)
                .noTypeInfo();
        return new DefaultKafkaProducerFactory<>(
                producerConfigs(),
                new StringSerializer(),
                jsonSerde.serializer()
        );
    }

    /**
     * KafkaTemplate for sending messages.
     */
    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(producerFactory);
        template.setObservationEnabled(true);
        return template;
    }
}

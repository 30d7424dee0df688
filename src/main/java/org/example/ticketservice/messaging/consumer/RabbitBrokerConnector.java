package org.example.ticketservice.messaging.consumer;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens RabbitMQ sessions bound to the inbound fan-out exchange.
 * The client's own automatic recovery is expected to be off; reconnecting is
 * the consumer loop's job.
 */
@Slf4j
public class RabbitBrokerConnector implements BrokerConnector {

    private static final String CONNECTION_NAME = "ticket-service-consumer";

    private final ConnectionFactory connectionFactory;
    private final String exchange;
    private final String queue;
    private final int prefetchCount;

    public RabbitBrokerConnector(ConnectionFactory connectionFactory, String exchange, String queue,
                                 int prefetchCount) {
        this.connectionFactory = connectionFactory;
        this.exchange = exchange;
        this.queue = queue;
        this.prefetchCount = prefetchCount;
    }

    @Override
    public BrokerSession open() throws IOException, TimeoutException {
        log.info("🔌 Connecting to RabbitMQ at {}:{}...", connectionFactory.getHost(), connectionFactory.getPort());
        Connection connection = connectionFactory.newConnection(CONNECTION_NAME);
        try {
            return RabbitBrokerSession.open(connection, exchange, queue, prefetchCount);
        } catch (IOException | RuntimeException e) {
            closeAfterFailedSetup(connection);
            throw e;
        }
    }

    private void closeAfterFailedSetup(Connection connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Ignoring failure while closing half-open connection: {}", e.getMessage());
        }
    }
}

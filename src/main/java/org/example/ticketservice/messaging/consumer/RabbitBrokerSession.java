package org.example.ticketservice.messaging.consumer;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * RabbitMQ session: one connection, one channel, one manual-ack consumer.
 *
 * <p>The client library delivers on its own dispatch thread; deliveries are
 * queued and handed to the consumer loop one at a time, so processing order
 * equals delivery order. A connection or channel shutdown wakes the loop
 * through a marker entry.</p>
 */
@Slf4j
public class RabbitBrokerSession implements BrokerSession {

    private static final InboundDelivery SHUTDOWN_MARKER = new InboundDelivery(-1L, new byte[0], false);

    private final Connection connection;
    private final Channel channel;
    private final BlockingQueue<InboundDelivery> deliveries = new LinkedBlockingQueue<>();
    private volatile ShutdownSignalException shutdownCause;

    RabbitBrokerSession(Connection connection, Channel channel) {
        this.connection = connection;
        this.channel = channel;
    }

    /**
     * Declares the durable fan-out exchange and durable queue, binds them and
     * starts consuming with manual acknowledgement.
     */
    static RabbitBrokerSession open(Connection connection, String exchange, String queue,
                                    int prefetchCount) throws IOException {
        Channel channel = connection.createChannel();
        channel.exchangeDeclare(exchange, BuiltinExchangeType.FANOUT, true);
        channel.queueDeclare(queue, true, false, false, null);
        channel.queueBind(queue, exchange, "");
        channel.basicQos(prefetchCount);

        RabbitBrokerSession session = new RabbitBrokerSession(connection, channel);
        connection.addShutdownListener(session::onShutdown);
        channel.addShutdownListener(session::onShutdown);
        channel.basicConsume(queue, false, session::onDelivery, session::onCancel);
        return session;
    }

    void onDelivery(String consumerTag, Delivery message) {
        deliveries.add(new InboundDelivery(
                message.getEnvelope().getDeliveryTag(),
                message.getBody(),
                message.getEnvelope().isRedeliver()));
    }

    void onCancel(String consumerTag) {
        log.warn("⚠️ Broker cancelled consumer {}", consumerTag);
        deliveries.add(SHUTDOWN_MARKER);
    }

    void onShutdown(ShutdownSignalException cause) {
        shutdownCause = cause;
        deliveries.add(SHUTDOWN_MARKER);
    }

    @Override
    public InboundDelivery nextDelivery() throws IOException, InterruptedException {
        InboundDelivery delivery = deliveries.take();
        if (delivery == SHUTDOWN_MARKER) {
            ShutdownSignalException cause = shutdownCause;
            String reason = cause != null ? cause.getMessage() : "consumer cancelled by broker";
            throw new BrokerConnectionLostException("Broker session closed: " + reason, cause);
        }
        return delivery;
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
        channel.basicAck(deliveryTag, false);
    }

    @Override
    public void nackWithoutRequeue(long deliveryTag) throws IOException {
        channel.basicNack(deliveryTag, false, false);
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen() && channel.isOpen();
    }

    @Override
    public void close() {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Ignoring failure while closing consumer connection: {}", e.getMessage());
        }
    }
}

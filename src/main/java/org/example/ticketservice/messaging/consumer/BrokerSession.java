package org.example.ticketservice.messaging.consumer;

import java.io.IOException;

/**
 * One open broker connection with its consuming channel.
 * Owned by a single pass of the consumer loop and closed when that pass ends.
 */
public interface BrokerSession extends AutoCloseable {

    /**
     * Blocks until the next message arrives.
     *
     * @throws BrokerConnectionLostException if the connection or channel shut down while waiting
     * @throws InterruptedException          if the consuming thread is interrupted
     */
    InboundDelivery nextDelivery() throws IOException, InterruptedException;

    void ack(long deliveryTag) throws IOException;

    /**
     * Negative acknowledgement. The message is discarded (or dead-lettered by
     * broker policy), never redelivered to this queue.
     */
    void nackWithoutRequeue(long deliveryTag) throws IOException;

    boolean isOpen();

    @Override
    void close();
}

package org.example.ticketservice.messaging.consumer;

import lombok.Value;

/**
 * A message handed over by the broker, awaiting ack or nack.
 */
@Value
public class InboundDelivery {
    long deliveryTag;
    byte[] body;
    boolean redelivered;
}

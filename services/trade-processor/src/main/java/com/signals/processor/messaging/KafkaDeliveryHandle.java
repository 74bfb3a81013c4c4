package com.signals.processor.messaging;

import java.time.Duration;

import org.springframework.kafka.support.Acknowledgment;

/**
 * {@link DeliveryHandle} over a Kafka record.
 * Acknowledging commits the offset; a requeue seeks back so the same record is polled again;
 * a drop commits past the record.
 */
public class KafkaDeliveryHandle implements DeliveryHandle {

    private final Acknowledgment acknowledgment;
    private final int partition;
    private final long offset;
    private final Duration requeueDelay;

    public KafkaDeliveryHandle(Acknowledgment acknowledgment, int partition, long offset, Duration requeueDelay) {
        this.acknowledgment = acknowledgment;
        this.partition = partition;
        this.offset = offset;
        this.requeueDelay = requeueDelay;
    }

    @Override
    public void ack() {
        acknowledgment.acknowledge();
    }

    @Override
    public void reject(boolean requeue) {
        if (requeue) {
            acknowledgment.nack(requeueDelay);
        } else {
            acknowledgment.acknowledge();
        }
    }

    @Override
    public String describe() {
        return "partition " + partition + " offset " + offset;
    }
}

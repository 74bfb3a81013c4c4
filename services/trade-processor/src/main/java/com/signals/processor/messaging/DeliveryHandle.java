package com.signals.processor.messaging;

/**
 * Broker-side handle of one delivered message. Exactly one of the methods is called per delivery.
 */
public interface DeliveryHandle {

    /** Removes the message from the queue for good. */
    void ack();

    /**
     * @param requeue true to have the message delivered again, false to drop it
     */
    void reject(boolean requeue);

    /** Short description for log lines, e.g. partition and offset. */
    String describe();
}

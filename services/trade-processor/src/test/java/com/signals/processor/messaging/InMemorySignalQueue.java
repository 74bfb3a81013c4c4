package com.signals.processor.messaging;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.signals.processor.service.SignalProcessor;

/**
 * Test broker: one queue, competing consumers served round-robin, ack/nack per delivery.
 * A requeued message goes back to the head of the queue.
 */
class InMemorySignalQueue {

    private final Deque<Message> ready = new ArrayDeque<>();
    private final List<SignalProcessor> consumers = new ArrayList<>();
    private final List<Delivery> deliveries = new ArrayList<>();
    private final List<String> acked = new ArrayList<>();
    private final List<String> dropped = new ArrayList<>();
    private int nextConsumer;

    void register(SignalProcessor consumer) {
        consumers.add(consumer);
    }

    void send(String payload) {
        ready.addLast(new Message(payload));
    }

    /**
     * Delivers messages one at a time until the queue is empty or the delivery budget runs out.
     *
     * @return number of deliveries made
     */
    int drain(int maxDeliveries) {
        int made = 0;
        while (!ready.isEmpty() && made < maxDeliveries) {
            Message message = ready.pollFirst();
            int consumerIndex = nextConsumer++ % consumers.size();
            message.deliveryCount++;
            deliveries.add(new Delivery(consumerIndex, message.payload));
            consumers.get(consumerIndex).process(message.payload, new Handle(message));
            made++;
        }
        return made;
    }

    int pending() {
        return ready.size();
    }

    List<Delivery> deliveries() {
        return deliveries;
    }

    List<String> acked() {
        return acked;
    }

    List<String> dropped() {
        return dropped;
    }

    record Delivery(int consumerIndex, String payload) {}

    private static class Message {
        private final String payload;
        private int deliveryCount;

        Message(String payload) {
            this.payload = payload;
        }
    }

    private class Handle implements DeliveryHandle {
        private final Message message;
        private boolean settled;

        Handle(Message message) {
            this.message = message;
        }

        @Override
        public void ack() {
            settle();
            acked.add(message.payload);
        }

        @Override
        public void reject(boolean requeue) {
            settle();
            if (requeue) {
                ready.addFirst(message);
            } else {
                dropped.add(message.payload);
            }
        }

        @Override
        public String describe() {
            return "delivery " + message.deliveryCount;
        }

        private void settle() {
            if (settled) {
                throw new IllegalStateException("Delivery already settled");
            }
            settled = true;
        }
    }
}

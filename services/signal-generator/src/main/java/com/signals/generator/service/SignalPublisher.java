package com.signals.generator.service;

import java.util.concurrent.CompletableFuture;

import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.kafka.BrokerUnavailableException;
import com.signals.common.model.TradeSignal;
import com.signals.generator.config.GeneratorProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Queue publisher - hands encoded signals to the broker.
 * Fire-and-forget: the broker acknowledgment is only logged and counted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final TradeSignalCodec codec;
    private final GeneratorProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * @throws BrokerUnavailableException if the broker cannot be reached or refuses the send
     */
    public void publish(TradeSignal signal) {
        String payload = codec.encode(signal);
        String topic = properties.getTopic();

        CompletableFuture<SendResult<String, String>> future;
        try {
            future = kafkaTemplate.send(topic, payload);
        } catch (RuntimeException e) {
            incrementCounter("signals.failed", topic);
            throw new BrokerUnavailableException("Broker refused signal for " + signal.getAssetId(), e);
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Published signal to {} partition {}",
                        topic, result.getRecordMetadata().partition());
                incrementCounter("signals.published", topic);
            } else {
                log.error("Failed to publish signal for {}: {}", signal.getAssetId(), ex.getMessage());
                incrementCounter("signals.failed", topic);
            }
        });
    }

    private void incrementCounter(String name, String topic) {
        Counter.builder("signals.generator." + name)
                .tag("topic", topic)
                .register(meterRegistry)
                .increment();
    }
}

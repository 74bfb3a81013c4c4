package com.signals.processor.messaging;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import com.signals.processor.config.ProcessorProperties;
import com.signals.processor.service.ProcessingOutcome;
import com.signals.processor.service.SignalProcessor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka consumer for the trading_signals topic.
 * All processor instances share one consumer group, so each signal reaches exactly one of them.
 * Each listener thread handles one record at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalConsumer {

    private final SignalProcessor signalProcessor;
    private final ProcessorProperties properties;

    @KafkaListener(
        topics = "${signals.processor.topic}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeSignal(
            @Payload(required = false) String payload,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Consuming signal from partition {} offset {}", partition, offset);

        DeliveryHandle delivery = new KafkaDeliveryHandle(
                acknowledgment, partition, offset, properties.getRequeueDelay());

        ProcessingOutcome outcome = signalProcessor.process(payload, delivery);

        log.debug("Partition {} offset {} finished as {}", partition, offset, outcome.getState());
    }
}

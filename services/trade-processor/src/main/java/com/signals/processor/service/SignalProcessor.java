package com.signals.processor.service;

import org.springframework.stereotype.Service;

import com.signals.common.codec.MalformedMessageException;
import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.model.TradeRecord;
import com.signals.common.model.TradeSignal;
import com.signals.processor.messaging.DeliveryHandle;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Acknowledgment controller for one delivered message.
 *
 * Flow:
 * 1. PARSING - decode the payload; a malformed payload is dropped (no requeue)
 * 2. PRICING - cache-aside price lookup
 * 3. RECORDING - history append and counter increment
 * 4. ACKED on success; any failure in 2 or 3 is REJECTED with requeue
 *
 * Requeued messages are redelivered without limit or backoff. There is no dead-letter path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalProcessor {

    private final TradeSignalCodec codec;
    private final PricingCache pricingCache;
    private final TradeRecorder tradeRecorder;
    private final MeterRegistry meterRegistry;

    public ProcessingOutcome process(String payload, DeliveryHandle delivery) {
        TradeSignal signal;
        try {
            signal = codec.decode(payload);
        } catch (MalformedMessageException e) {
            log.warn("Dropping malformed message at {}: {}", delivery.describe(), e.getMessage());
            delivery.reject(false);
            incrementCounter("messages.invalid");
            return ProcessingOutcome.rejected(ProcessingState.PARSING, false, e.getMessage());
        }

        log.info("Processing signal: {} {} MWh for {}", signal.getAction(), signal.getVolume(), signal.getAssetId());

        ProcessingState state = ProcessingState.PRICING;
        TradeRecord record;
        try {
            double price = pricingCache.getPrice(signal.getAssetId());

            state = ProcessingState.RECORDING;
            record = tradeRecorder.record(signal, price);

        } catch (Exception e) {
            log.error("Error processing message at {} during {}: {}",
                    delivery.describe(), state, e.getMessage(), e);
            delivery.reject(true);
            incrementCounter("messages.requeued");
            return ProcessingOutcome.rejected(state, true, e.getMessage());
        }

        delivery.ack();
        incrementCounter("messages.processed");
        log.info("Trade saved: {} {} MWh @ {} = {}",
                record.getAction(), record.getVolume(), record.getPrice(), record.getTotalValue());

        return ProcessingOutcome.acked(record);
    }

    private void incrementCounter(String name) {
        Counter.builder("signals.processor." + name)
                .tag("service", "trade-processor")
                .register(meterRegistry)
                .increment();
    }
}

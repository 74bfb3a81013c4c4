package com.signals.generator.service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import org.springframework.stereotype.Service;

import com.signals.common.model.TradeSignal;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts signals produced outside the generator and queues them for processing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalIngestionService {

    private final SignalPublisher signalPublisher;
    private final Clock signalClock;
    private final MeterRegistry meterRegistry;

    public TradeSignal ingestSignal(TradeSignal request) {
        TradeSignal signal = request;

        if (signal.getVolume() != null && !Double.isFinite(signal.getVolume())) {
            throw new IllegalArgumentException("Volume must be a finite number: " + signal.getVolume());
        }

        if (signal.getTimestamp() == null || signal.getTimestamp().isBlank()) {
            signal = signal.toBuilder()
                    .timestamp(Instant.now(signalClock).toString())
                    .build();
        } else {
            try {
                Instant.parse(signal.getTimestamp());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Timestamp must be ISO-8601: " + signal.getTimestamp());
            }
        }

        signalPublisher.publish(signal);
        log.debug("Queued external signal: assetId={}, action={}, volume={}",
                signal.getAssetId(), signal.getAction(), signal.getVolume());

        Counter.builder("signals.generator.signals.ingested")
                .tag("assetId", signal.getAssetId())
                .tag("action", signal.getAction().name())
                .register(meterRegistry)
                .increment();

        return signal;
    }
}

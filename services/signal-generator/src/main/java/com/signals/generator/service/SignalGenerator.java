package com.signals.generator.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Random;

import org.springframework.stereotype.Service;

import com.signals.common.model.TradeAction;
import com.signals.common.model.TradeSignal;
import com.signals.common.model.TradeValues;
import com.signals.generator.config.GeneratorProperties;

import lombok.RequiredArgsConstructor;

/**
 * Produces mock trading signals.
 * No I/O: the only inputs are the random source and the clock, both injected.
 */
@Service
@RequiredArgsConstructor
public class SignalGenerator {

    private static final TradeAction[] ACTIONS = TradeAction.values();

    private final Random signalRandom;
    private final Clock signalClock;
    private final GeneratorProperties properties;

    public TradeSignal generate() {
        TradeAction action = ACTIONS[signalRandom.nextInt(ACTIONS.length)];

        double min = properties.getVolume().getMin();
        double max = properties.getVolume().getMax();
        double volume = TradeValues.round2(min + signalRandom.nextDouble() * (max - min));

        return TradeSignal.builder()
                .assetId(properties.getAssetId())
                .action(action)
                .volume(volume)
                .timestamp(Instant.now(signalClock).toString())
                .build();
    }
}

package com.signals.generator.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.signals.common.kafka.BrokerUnavailableException;
import com.signals.common.kafka.ProcessTerminator;
import com.signals.common.model.TradeSignal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Timer loop: one generated signal per tick, published synchronously.
 * A broker failure ends the process; there is no retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalEmitter {

    private final SignalGenerator signalGenerator;
    private final SignalPublisher signalPublisher;
    private final ProcessTerminator terminator;

    @Scheduled(
        fixedRateString = "${signals.generator.interval-ms:3000}",
        initialDelayString = "${signals.generator.interval-ms:3000}"
    )
    public void emit() {
        TradeSignal signal = signalGenerator.generate();

        try {
            signalPublisher.publish(signal);
            log.info("Signal sent: {} {} MWh for {}", signal.getAction(), signal.getVolume(), signal.getAssetId());
        } catch (BrokerUnavailableException e) {
            terminator.terminate(e.getMessage(), e);
        }
    }
}

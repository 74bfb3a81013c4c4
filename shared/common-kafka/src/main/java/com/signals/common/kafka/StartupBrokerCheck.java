package com.signals.common.kafka;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Terminates the application when the broker is unreachable once the context is ready.
 */
@RequiredArgsConstructor
@Slf4j
public class StartupBrokerCheck {

    private final BrokerConnectionVerifier verifier;
    private final ProcessTerminator terminator;
    private final boolean enabled;
    private final String topic;

    @EventListener(ApplicationReadyEvent.class)
    public void verifyBroker() {
        if (!enabled) {
            log.info("Startup broker check is disabled");
            return;
        }

        try {
            String clusterId = verifier.verify();
            log.info("Broker reachable, using topic {} (cluster {})", topic, clusterId);
        } catch (BrokerUnavailableException e) {
            terminator.terminate(e.getMessage(), e);
        }
    }
}

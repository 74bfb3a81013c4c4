package com.signals.generator.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.signals.common.kafka.SignalTopics;

import lombok.Data;

/**
 * Configuration properties for the signal generator
 */
@Data
@ConfigurationProperties(prefix = "signals.generator")
public class GeneratorProperties {

    private String topic = SignalTopics.TRADING_SIGNALS;
    private int partitions = 3;
    private String assetId = "BATTERY_GRID_01";
    private long intervalMs = 3000;
    private Volume volume = new Volume();
    private Startup startup = new Startup();

    @Data
    public static class Volume {
        private double min = 10;
        private double max = 110;
    }

    @Data
    public static class Startup {
        private boolean verifyBroker = true;
        private Duration brokerTimeout = Duration.ofSeconds(10);
    }
}

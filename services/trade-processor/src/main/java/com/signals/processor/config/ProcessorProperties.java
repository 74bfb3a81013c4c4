package com.signals.processor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.signals.common.kafka.SignalTopics;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Configuration properties for the trade processor
 */
@Data
@Validated
@ConfigurationProperties(prefix = "signals.processor")
public class ProcessorProperties {

    @NotBlank
    private String topic = SignalTopics.TRADING_SIGNALS;

    @Valid
    private Pricing pricing = new Pricing();

    @Valid
    private History history = new History();

    @Valid
    private Store store = new Store();

    @Valid
    private Startup startup = new Startup();

    /** Pause before a requeued message is redelivered. */
    @NotNull
    private Duration requeueDelay = Duration.ZERO;

    @Data
    public static class Pricing {
        @NotNull
        private Duration ttl = Duration.ofSeconds(30);
        @Positive
        private double min = 50;
        @Positive
        private double max = 150;
    }

    @Data
    public static class History {
        /** Zero or less would turn LTRIM into a no-op and lift the cap. */
        @Min(1)
        private int maxSize = 100;
    }

    @Data
    public static class Store {
        @NotNull
        private StoreType type = StoreType.REDIS;
    }

    @Data
    public static class Startup {
        private boolean verifyBroker = true;
        @NotNull
        private Duration brokerTimeout = Duration.ofSeconds(10);
    }

    public enum StoreType {
        REDIS, MEMORY
    }
}

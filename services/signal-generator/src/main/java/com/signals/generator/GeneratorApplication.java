package com.signals.generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Signal Generator Service - emits trading signals on a fixed cadence.
 *
 * Responsibilities:
 * - Generate a random BUY/SELL signal every tick (3s by default)
 * - Publish it to the trading_signals queue
 * - Accept externally produced signals via REST and publish them the same way
 * - Exit if the broker cannot be reached
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class GeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeneratorApplication.class, args);
    }
}

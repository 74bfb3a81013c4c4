package com.signals.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Trade Processor Service - prices and records trading signals.
 *
 * Responsibilities:
 * - Consume signals from the trading_signals queue, competing with other instances
 * - Look up the asset price through the cache-aside pricing layer
 * - Append the trade to the bounded history and bump the per-asset counter
 * - Acknowledge on success, requeue on processing failure, drop malformed payloads
 */
@SpringBootApplication
@EnableKafka
@ConfigurationPropertiesScan
public class ProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcessorApplication.class, args);
    }
}

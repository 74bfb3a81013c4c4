package com.signals.processor.config;

import java.time.Clock;
import java.util.Random;

import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaAdmin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.kafka.BrokerConnectionVerifier;
import com.signals.common.kafka.ProcessTerminator;
import com.signals.common.kafka.StartupBrokerCheck;

@Configuration
public class ProcessorConfig {

    @Bean
    public Clock processorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random priceRandom() {
        return new Random();
    }

    @Bean
    public TradeSignalCodec tradeSignalCodec(ObjectMapper objectMapper) {
        return new TradeSignalCodec(objectMapper);
    }

    @Bean
    public BrokerConnectionVerifier brokerConnectionVerifier(KafkaAdmin kafkaAdmin, ProcessorProperties properties) {
        return new BrokerConnectionVerifier(
                kafkaAdmin.getConfigurationProperties(),
                properties.getStartup().getBrokerTimeout());
    }

    @Bean
    public ProcessTerminator processTerminator(ConfigurableApplicationContext context) {
        return new ProcessTerminator(context);
    }

    @Bean
    public StartupBrokerCheck startupBrokerCheck(BrokerConnectionVerifier verifier,
                                                 ProcessTerminator terminator,
                                                 ProcessorProperties properties) {
        return new StartupBrokerCheck(verifier, terminator,
                properties.getStartup().isVerifyBroker(), properties.getTopic());
    }
}

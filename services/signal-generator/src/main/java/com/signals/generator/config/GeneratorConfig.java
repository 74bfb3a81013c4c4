package com.signals.generator.config;

import java.time.Clock;
import java.util.Random;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.kafka.BrokerConnectionVerifier;
import com.signals.common.kafka.ProcessTerminator;
import com.signals.common.kafka.StartupBrokerCheck;

@Configuration
public class GeneratorConfig {

    @Bean
    public Clock signalClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random signalRandom() {
        return new Random();
    }

    @Bean
    public TradeSignalCodec tradeSignalCodec(ObjectMapper objectMapper) {
        return new TradeSignalCodec(objectMapper);
    }

    @Bean
    public NewTopic tradingSignalsTopic(GeneratorProperties properties) {
        return TopicBuilder.name(properties.getTopic())
                .partitions(properties.getPartitions())
                .replicas(1)
                .build();
    }

    @Bean
    public BrokerConnectionVerifier brokerConnectionVerifier(KafkaAdmin kafkaAdmin, GeneratorProperties properties) {
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
                                                 GeneratorProperties properties) {
        return new StartupBrokerCheck(verifier, terminator,
                properties.getStartup().isVerifyBroker(), properties.getTopic());
    }
}

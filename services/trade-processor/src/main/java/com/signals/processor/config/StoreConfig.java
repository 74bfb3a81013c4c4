package com.signals.processor.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.signals.processor.store.InMemoryTradeStore;
import com.signals.processor.store.RedisTradeStore;
import com.signals.processor.store.TradeStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Selects the store backing the price cache, trade history and counters.
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "signals.processor.store.type", havingValue = "redis", matchIfMissing = true)
    public TradeStore redisTradeStore(StringRedisTemplate redisTemplate) {
        log.info("Using Redis trade store");
        return new RedisTradeStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "signals.processor.store.type", havingValue = "memory")
    public TradeStore inMemoryTradeStore(Clock processorClock) {
        log.warn("Using in-memory trade store; state is not shared with other processor instances");
        return new InMemoryTradeStore(processorClock);
    }
}

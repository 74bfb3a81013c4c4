package com.signals.processor.service;

import java.util.Optional;
import java.util.Random;

import org.springframework.stereotype.Service;

import com.signals.common.model.TradeValues;
import com.signals.processor.config.ProcessorProperties;
import com.signals.processor.store.StoreKeys;
import com.signals.processor.store.TradeStore;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache-aside asset pricing.
 *
 * <p>A live {@code price:{assetId}} entry is returned as is. On a miss a new price is drawn
 * and written with the configured TTL. The read and the write are separate store calls, so two
 * instances missing at the same time may each draw a price; the last write wins and the two
 * callers may see different prices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PricingCache {

    private final TradeStore tradeStore;
    private final Random priceRandom;
    private final ProcessorProperties properties;
    private final MeterRegistry meterRegistry;

    public double getPrice(String assetId) {
        String key = StoreKeys.price(assetId);

        Optional<String> cached = tradeStore.get(key);
        if (cached.isPresent()) {
            log.debug("Cache HIT: price for {} = {}", assetId, cached.get());
            incrementCounter("cache.hit");
            return Double.parseDouble(cached.get());
        }

        ProcessorProperties.Pricing pricing = properties.getPricing();
        double price = TradeValues.round2(
                pricing.getMin() + priceRandom.nextDouble() * (pricing.getMax() - pricing.getMin()));

        tradeStore.setWithTtl(key, Double.toString(price), pricing.getTtl());
        log.info("Cache MISS: generated price for {} = {} (cached for {}s)",
                assetId, price, pricing.getTtl().toSeconds());
        incrementCounter("cache.miss");

        return price;
    }

    private void incrementCounter(String name) {
        Counter.builder("signals.processor." + name)
                .tag("service", "trade-processor")
                .register(meterRegistry)
                .increment();
    }
}

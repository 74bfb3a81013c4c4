package com.signals.processor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.model.TradeAction;
import com.signals.common.model.TradeSignal;
import com.signals.processor.MutableClock;
import com.signals.processor.config.ProcessorProperties;
import com.signals.processor.store.InMemoryTradeStore;

class TradeHistoryServiceTest {

    private final TradeSignalCodec codec = new TradeSignalCodec(new ObjectMapper());
    private final ProcessorProperties properties = new ProcessorProperties();

    private InMemoryTradeStore store;
    private TradeRecorder recorder;
    private TradeHistoryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryTradeStore(new MutableClock(Instant.parse("2026-05-04T12:00:00Z")));
        recorder = new TradeRecorder(store, codec, properties);
        service = new TradeHistoryService(store, codec, properties);
    }

    @Test
    void recentTradesAreNewestFirst() {
        recorder.record(TradeSignal.of("X", TradeAction.BUY, 1.0, "2026-05-04T12:00:00Z"), 50.0);
        recorder.record(TradeSignal.of("X", TradeAction.BUY, 2.0, "2026-05-04T12:00:01Z"), 50.0);
        recorder.record(TradeSignal.of("Y", TradeAction.SELL, 3.0, "2026-05-04T12:00:02Z"), 50.0);

        assertThat(service.recentTrades(2)).extracting(r -> r.getVolume()).containsExactly(3.0, 2.0);
        assertThat(service.recentTrades(500)).hasSize(3);
    }

    @Test
    void unreadableEntriesAreSkipped() {
        recorder.record(TradeSignal.of("X", TradeAction.BUY, 1.0, "2026-05-04T12:00:00Z"), 50.0);
        store.prependAndTrim("trade_history", "garbage", 100);

        assertThat(service.recentTrades(10)).hasSize(1);
    }

    @Test
    void countDefaultsToZero() {
        recorder.record(TradeSignal.of("X", TradeAction.BUY, 1.0, "2026-05-04T12:00:00Z"), 50.0);

        assertThat(service.tradeCount("X")).isEqualTo(1);
        assertThat(service.tradeCount("NEVER_TRADED")).isZero();
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThatThrownBy(() -> service.recentTrades(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

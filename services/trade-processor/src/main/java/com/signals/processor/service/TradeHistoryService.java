package com.signals.processor.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.signals.common.codec.MalformedMessageException;
import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.model.TradeRecord;
import com.signals.processor.config.ProcessorProperties;
import com.signals.processor.store.StoreKeys;
import com.signals.processor.store.TradeStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only views over the shared trade history and counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeHistoryService {

    private final TradeStore tradeStore;
    private final TradeSignalCodec codec;
    private final ProcessorProperties properties;

    /**
     * @return up to {@code limit} most recent trades, newest first
     */
    public List<TradeRecord> recentTrades(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        int capped = Math.min(limit, properties.getHistory().getMaxSize());

        List<TradeRecord> trades = new ArrayList<>();
        for (String entry : tradeStore.range(StoreKeys.TRADE_HISTORY, capped)) {
            try {
                trades.add(codec.decodeRecord(entry));
            } catch (MalformedMessageException e) {
                log.warn("Skipping unreadable history entry: {}", e.getMessage());
            }
        }
        return trades;
    }

    public long tradeCount(String assetId) {
        return tradeStore.get(StoreKeys.tradeCount(assetId))
                .map(Long::parseLong)
                .orElse(0L);
    }
}

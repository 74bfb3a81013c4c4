package com.signals.processor.service;

import org.springframework.stereotype.Service;

import com.signals.common.codec.TradeSignalCodec;
import com.signals.common.model.TradeRecord;
import com.signals.common.model.TradeSignal;
import com.signals.processor.config.ProcessorProperties;
import com.signals.processor.store.StoreKeys;
import com.signals.processor.store.TradeStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends processed trades to the shared history and counts them per asset.
 *
 * <p>History write and counter increment are independent store calls. If the increment fails
 * after the history write, the message is redelivered and the trade appears twice in the history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeRecorder {

    private final TradeStore tradeStore;
    private final TradeSignalCodec codec;
    private final ProcessorProperties properties;

    public TradeRecord record(TradeSignal signal, double price) {
        TradeRecord record = TradeRecord.of(signal, price);

        tradeStore.prependAndTrim(
                StoreKeys.TRADE_HISTORY,
                codec.encode(record),
                properties.getHistory().getMaxSize());

        long count = tradeStore.increment(StoreKeys.tradeCount(signal.getAssetId()));

        log.debug("Recorded trade: assetId={}, action={}, volume={}, price={}, totalValue={}, count={}",
                record.getAssetId(), record.getAction(), record.getVolume(),
                record.getPrice(), record.getTotalValue(), count);

        return record;
    }
}

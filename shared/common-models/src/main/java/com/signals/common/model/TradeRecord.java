package com.signals.common.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A processed trade: the originating signal plus the price it was valued at.
 * Stored JSON-encoded in the shared trade history list.
 */
@Value
@Builder
@Jacksonized
public class TradeRecord {

    String assetId;
    TradeAction action;
    Double volume;
    String timestamp;
    Double price;

    /** volume x price rendered with exactly two decimals. */
    String totalValue;

    public static TradeRecord of(TradeSignal signal, double price) {
        return TradeRecord.builder()
                .assetId(signal.getAssetId())
                .action(signal.getAction())
                .volume(signal.getVolume())
                .timestamp(signal.getTimestamp())
                .price(price)
                .totalValue(TradeValues.totalValue(signal.getVolume(), price))
                .build();
    }
}

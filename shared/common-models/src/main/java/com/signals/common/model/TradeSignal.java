package com.signals.common.model;

import java.time.Instant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Trading signal emitted by the generator and consumed by the trade processors.
 * This is the wire schema for the trading_signals queue and the REST ingest endpoint.
 *
 * <p>Immutable; equality is structural.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TradeSignal {

    @NotBlank(message = "Asset ID is required")
    String assetId;

    @NotNull(message = "Action is required")
    TradeAction action;

    /** Volume in MWh. */
    @NotNull(message = "Volume is required")
    @Positive(message = "Volume must be positive")
    Double volume;

    /** ISO-8601 instant at which the signal was generated. */
    String timestamp;

    /**
     * Creates a signal stamped with the current instant.
     */
    public static TradeSignal of(String assetId, TradeAction action, double volume) {
        return of(assetId, action, volume, Instant.now().toString());
    }

    public static TradeSignal of(String assetId, TradeAction action, double volume, String timestamp) {
        return TradeSignal.builder()
                .assetId(assetId)
                .action(action)
                .volume(volume)
                .timestamp(timestamp != null ? timestamp : Instant.now().toString())
                .build();
    }
}

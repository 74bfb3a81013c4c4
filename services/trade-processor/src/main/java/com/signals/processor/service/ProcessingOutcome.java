package com.signals.processor.service;

import com.signals.common.model.TradeRecord;

import lombok.Builder;
import lombok.Value;

/**
 * Terminal result of processing one delivery.
 */
@Value
@Builder
public class ProcessingOutcome {

    ProcessingState state;

    /** Step that failed; null when acknowledged. */
    ProcessingState failedAt;

    boolean requeued;

    TradeRecord record;

    String reason;

    public static ProcessingOutcome acked(TradeRecord record) {
        return ProcessingOutcome.builder()
                .state(ProcessingState.ACKED)
                .record(record)
                .build();
    }

    public static ProcessingOutcome rejected(ProcessingState failedAt, boolean requeued, String reason) {
        return ProcessingOutcome.builder()
                .state(ProcessingState.REJECTED)
                .failedAt(failedAt)
                .requeued(requeued)
                .reason(reason)
                .build();
    }
}

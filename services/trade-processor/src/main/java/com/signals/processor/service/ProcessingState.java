package com.signals.processor.service;

/**
 * Lifecycle of one delivered message inside a consumer instance.
 */
public enum ProcessingState {
    AWAITING_MESSAGE,
    PARSING,
    PRICING,
    RECORDING,
    ACKED,
    REJECTED;

    public boolean isTerminal() {
        return this == ACKED || this == REJECTED;
    }
}

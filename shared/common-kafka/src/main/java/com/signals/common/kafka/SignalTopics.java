package com.signals.common.kafka;

/**
 * Queue names shared by the signal generator and the trade processors.
 */
public final class SignalTopics {

    public static final String TRADING_SIGNALS = "trading_signals";

    // Consumer group shared by all trade processor instances; members compete for messages.
    public static final String TRADE_PROCESSORS_GROUP = "trade-processors";

    private SignalTopics() {
        throw new UnsupportedOperationException("Utility class");
    }
}

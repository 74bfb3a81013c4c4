package com.signals.processor.store;

/**
 * Key space shared by every trade processor instance.
 */
public final class StoreKeys {

    public static final String TRADE_HISTORY = "trade_history";

    private static final String PRICE_PREFIX = "price:";
    private static final String TRADE_COUNT_PREFIX = "trade_count:";

    private StoreKeys() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String price(String assetId) {
        return PRICE_PREFIX + assetId;
    }

    public static String tradeCount(String assetId) {
        return TRADE_COUNT_PREFIX + assetId;
    }
}

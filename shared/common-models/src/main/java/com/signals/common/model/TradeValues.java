package com.signals.common.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal arithmetic shared by the generator and the trade processors.
 */
public final class TradeValues {

    private TradeValues() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Renders {@code volume * price} with exactly two decimal places, e.g. 50.5 x 75.50 gives "3812.75".
     */
    public static String totalValue(double volume, double price) {
        return BigDecimal.valueOf(volume)
                .multiply(BigDecimal.valueOf(price))
                .setScale(2, RoundingMode.HALF_UP)
                .toPlainString();
    }

    /**
     * Rounds to two decimals, half-up.
     */
    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

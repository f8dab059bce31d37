package com.flagship.payments_engine.csv;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Output formatting for balances: four fractional digits, rounded half away from zero,
 * with trailing zeros dropped ({@code 100.0000 -> 100}, {@code 100.1200 -> 100.12}).
 */
public final class AmountFormatter {

    public static final int SCALE = 4;

    private AmountFormatter() {
        // Utility class
    }

    public static String format(BigDecimal value) {
        BigDecimal rounded = value.setScale(SCALE, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}

package com.swing.model;

import java.util.List;

/**
 * Indicator values computed for one symbol in one refresh cycle.
 *
 * <p>A {@code null} component means the series was too short for that indicator;
 * its name is then listed in {@code unavailable}. Sets are rebuilt from scratch on
 * every refresh and never patched.
 *
 * @param rsi         RSI(14), 0..100
 * @param macd        MACD(12,26,9), null below 26 closes; signal and histogram null below 34
 * @param sma20       20-day simple moving average
 * @param ema9        9-day exponential moving average
 * @param ema21       21-day exponential moving average
 * @param atr14       14-day average true range
 * @param bollinger   Bollinger(20, 2) levels
 * @param bbPosition  price position inside the bands, 0..1
 * @param unavailable names of the indicators that could not be computed
 */
public record IndicatorSet(
        Double rsi,
        MacdValue macd,
        Double sma20,
        Double ema9,
        Double ema21,
        Double atr14,
        BollingerBands bollinger,
        Double bbPosition,
        List<String> unavailable
) {

    public IndicatorSet {
        unavailable = unavailable == null ? List.of() : List.copyOf(unavailable);
    }

    public boolean isDegraded() {
        return !unavailable.isEmpty();
    }

    /**
     * ATR or zero when it could not be computed; used for premium estimates.
     */
    public double atrOrZero() {
        return atr14 == null ? 0.0 : atr14;
    }
}

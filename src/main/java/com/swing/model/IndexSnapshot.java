package com.swing.model;

import java.time.Instant;

/**
 * Latest level of the index reference instrument.
 *
 * @param symbol    Index symbol (e.g. "^NSEI")
 * @param price     Latest close
 * @param change    Absolute change versus the previous close
 * @param changePct Change in percent
 * @param asOf      When the level was fetched
 * @param available False when no level has ever been fetched
 */
public record IndexSnapshot(String symbol, double price, double change, double changePct,
                            Instant asOf, boolean available) {

    public static IndexSnapshot fromSeries(PriceSeries series, Instant asOf) {
        double[] closes = series.closes();
        double price = closes[closes.length - 1];
        double prev = closes.length > 1 ? closes[closes.length - 2] : price;
        double change = price - prev;
        double changePct = prev == 0 ? 0.0 : change / prev * 100.0;
        return new IndexSnapshot(series.getSymbol(), price, change, changePct, asOf, true);
    }

    public static IndexSnapshot unavailable(String symbol, Instant asOf) {
        return new IndexSnapshot(symbol, 0.0, 0.0, 0.0, asOf, false);
    }
}

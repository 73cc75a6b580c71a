package com.swing.model;

import java.time.LocalDate;

/**
 * One trading day of OHLC data.
 *
 * @param date   Trading date
 * @param open   Opening price
 * @param high   Highest traded price
 * @param low    Lowest traded price
 * @param close  Closing price
 * @param volume Traded volume (0 when the provider does not report it)
 */
public record PriceBar(LocalDate date, double open, double high, double low, double close, long volume) {

    public PriceBar {
        if (date == null) throw new IllegalArgumentException("Date must not be null");
        if (close <= 0) throw new IllegalArgumentException("Close must be positive");
        if (high < low) throw new IllegalArgumentException("High must be >= low");
        if (volume < 0) throw new IllegalArgumentException("Volume must be non-negative");
    }

    /**
     * Bar for sources that only report a closing price.
     */
    public static PriceBar ofClose(LocalDate date, double close) {
        return new PriceBar(date, close, close, close, close, 0L);
    }
}

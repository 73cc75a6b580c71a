package com.swing.provider;

import com.swing.model.PriceSeries;

/**
 * Source of daily OHLC history.
 *
 * <p>Implementations must be safe to call from several threads at once; one refresh
 * fetches the universe in parallel.
 */
public interface MarketDataProvider {

    /**
     * Fetch daily bars covering the last {@code days} calendar days, oldest first.
     *
     * @throws ProviderUnavailableException on transient failures (timeout, rate limit, 5xx)
     * @throws ProviderFatalException       when the symbol is unknown or has no data
     */
    PriceSeries fetchDaily(String symbol, int days);

    /** Human-readable data source label returned to the dashboard. */
    String description();
}

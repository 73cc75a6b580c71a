package com.swing.model;

import com.swing.strategy.OptionStrategy;

import java.time.Instant;
import java.util.List;

/**
 * Everything the dashboard shows for one symbol in one cache generation.
 *
 * <p>Immutable; a refresh builds a new instance rather than editing this one.
 *
 * @param symbol       Exchange symbol (e.g. "RELIANCE")
 * @param sector       Sector label from the universe configuration
 * @param price        Latest close
 * @param change1d     One-day change in percent
 * @param change5d     Five-day change in percent
 * @param priceHistory Recent closes, oldest first
 * @param indicators   Indicator values
 * @param signal       Score, direction and confidence
 * @param strategy     Recommended option strategy
 * @param asOf         Build time of the generation that computed this snapshot
 * @param stale        True when carried over from an earlier generation
 */
public record Snapshot(
        String symbol,
        String sector,
        double price,
        double change1d,
        double change5d,
        List<Double> priceHistory,
        IndicatorSet indicators,
        Signal signal,
        OptionStrategy strategy,
        Instant asOf,
        boolean stale
) {

    public Snapshot {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("Symbol must not be blank");
        if (indicators == null || signal == null || strategy == null) {
            throw new IllegalArgumentException("Indicators, signal and strategy are required");
        }
        if (asOf == null) throw new IllegalArgumentException("asOf must not be null");
        priceHistory = priceHistory == null ? List.of() : List.copyOf(priceHistory);
    }

    public Direction direction() {
        return signal.direction();
    }

    /**
     * Copy flagged as carried over; the original {@code asOf} is preserved.
     */
    public Snapshot markStale() {
        if (stale) return this;
        return new Snapshot(symbol, sector, price, change1d, change5d, priceHistory,
                indicators, signal, strategy, asOf, true);
    }
}

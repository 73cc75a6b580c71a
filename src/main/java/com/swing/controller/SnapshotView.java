package com.swing.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.swing.model.BollingerBands;
import com.swing.model.IndicatorSet;
import com.swing.model.MacdValue;
import com.swing.model.Snapshot;
import com.swing.strategy.OptionStrategy;

import java.time.Instant;
import java.util.List;

import static com.swing.controller.Rounding.round;

/**
 * JSON form of one {@link Snapshot}.
 *
 * <pre>
 * {
 *   "sym": "RELIANCE", "sector": "Energy", "price": 2950.4, "change": 1.12,
 *   "rsi": 71.3, "macd": {"macd": 12.1, "signal": 9.8, "hist": 2.3},
 *   "bb": {"upper": 3001.2, "mid": 2900.5, "lower": 2799.8}, "bbPos": 0.75,
 *   "score": 3.5, "direction": "LONG", "confidence": 50,
 *   "optionStrategy": "ATM Call Buy", "optionDetails": {"buy": "RELIANCE 2950 CE", ...},
 *   ...
 * }
 * </pre>
 *
 * Indicators that could not be computed are null and listed in {@code unavailable}.
 * A MACD without enough history for its signal line has null {@code signal} and {@code hist}.
 */
public record SnapshotView(
        @JsonProperty("sym") String symbol,
        String sector,
        double price,
        double change,
        double change5d,
        List<Double> priceHistory,
        Double rsi,
        Macd macd,
        Double sma20,
        Double ema9,
        Double ema21,
        Double atr,
        @JsonProperty("bb") Bands bollinger,
        Double bbPos,
        double score,
        String direction,
        int confidence,
        String optionStrategy,
        OptionStrategy optionDetails,
        List<String> reasons,
        Instant lastUpdated,
        boolean stale,
        List<String> unavailable
) {

    public record Macd(double macd, Double signal, Double hist) {

        static Macd from(MacdValue value) {
            if (value == null) return null;
            return new Macd(round(value.line()), round(value.signal()), round(value.histogram()));
        }
    }

    public record Bands(double upper, double mid, double lower) {

        static Bands from(BollingerBands bands) {
            if (bands == null) return null;
            return new Bands(round(bands.upper()), round(bands.mid()), round(bands.lower()));
        }
    }

    public static SnapshotView from(Snapshot snapshot) {
        if (snapshot == null) return null;
        IndicatorSet ind = snapshot.indicators();
        return new SnapshotView(
                snapshot.symbol(),
                snapshot.sector(),
                round(snapshot.price()),
                round(snapshot.change1d()),
                round(snapshot.change5d()),
                snapshot.priceHistory().stream().map(p -> round(p)).toList(),
                round(ind.rsi()),
                Macd.from(ind.macd()),
                round(ind.sma20()),
                round(ind.ema9()),
                round(ind.ema21()),
                round(ind.atr14()),
                Bands.from(ind.bollinger()),
                round(ind.bbPosition()),
                round(snapshot.signal().score()),
                snapshot.direction().name(),
                snapshot.signal().confidence(),
                snapshot.strategy().name().getLabel(),
                snapshot.strategy(),
                snapshot.signal().reasons(),
                snapshot.asOf(),
                snapshot.stale(),
                ind.unavailable()
        );
    }
}

package com.swing.model;

import java.util.List;

/**
 * Chronological (oldest first) daily price history for one symbol.
 *
 * <p>Immutable: the bar list is copied on construction and every column accessor
 * returns a fresh array, so indicator code can never write back into the series.
 */
public final class PriceSeries {

    private final String symbol;
    private final List<PriceBar> bars;

    public PriceSeries(String symbol, List<PriceBar> bars) {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("Symbol must not be blank");
        if (bars == null) throw new IllegalArgumentException("Bars must not be null");
        for (int i = 1; i < bars.size(); i++) {
            if (!bars.get(i).date().isAfter(bars.get(i - 1).date())) {
                throw new IllegalArgumentException("Bars must be strictly ascending by date: "
                        + bars.get(i - 1).date() + " then " + bars.get(i).date());
            }
        }
        this.symbol = symbol;
        this.bars = List.copyOf(bars);
    }

    public String getSymbol() {
        return symbol;
    }

    public List<PriceBar> getBars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public double lastClose() {
        if (bars.isEmpty()) throw new IllegalStateException("Series for " + symbol + " is empty");
        return bars.get(bars.size() - 1).close();
    }

    public double[] closes() {
        return bars.stream().mapToDouble(PriceBar::close).toArray();
    }

    public double[] highs() {
        return bars.stream().mapToDouble(PriceBar::high).toArray();
    }

    public double[] lows() {
        return bars.stream().mapToDouble(PriceBar::low).toArray();
    }

    /**
     * The last {@code count} closes, or all of them when the series is shorter.
     */
    public List<Double> tailCloses(int count) {
        int from = Math.max(0, bars.size() - count);
        return bars.subList(from, bars.size()).stream().map(PriceBar::close).toList();
    }
}

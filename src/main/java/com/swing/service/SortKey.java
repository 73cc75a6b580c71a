package com.swing.service;

import com.swing.model.Snapshot;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Orderings offered by the stocks listing.
 */
public enum SortKey {

    /** Highest confidence first, then highest |score|. */
    CONFIDENCE("confidence", Comparator
            .comparingInt((Snapshot s) -> s.signal().confidence()).reversed()
            .thenComparing(Comparator.comparingDouble((Snapshot s) -> Math.abs(s.signal().score())).reversed())),

    /** Most bullish first. */
    SCORE("score", Comparator.comparingDouble((Snapshot s) -> s.signal().score()).reversed()),

    /** Largest one-day gain first. */
    CHANGE("change", Comparator.comparingDouble(Snapshot::change1d).reversed()),

    /** Most oversold first; symbols without an RSI go last. */
    RSI("rsi", Comparator.comparing((Snapshot s) -> s.indicators().rsi(),
            Comparator.nullsLast(Comparator.<Double>naturalOrder()))),

    SYMBOL("symbol", Comparator.comparing(Snapshot::symbol));

    private final String label;
    private final Comparator<Snapshot> comparator;

    SortKey(String label, Comparator<Snapshot> comparator) {
        this.label = label;
        this.comparator = comparator;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Comparator with the symbol as final tie-breaker so the order is total.
     */
    public Comparator<Snapshot> comparator() {
        return comparator.thenComparing(Snapshot::symbol);
    }

    public static Optional<SortKey> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.label.equals(wanted)).findFirst();
    }

    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(SortKey::getLabel).toArray(String[]::new);
    }
}

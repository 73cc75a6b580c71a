package com.swing.service;

/**
 * Direction counts over one generation. Percentages are of {@code total}, the number
 * of snapshots actually present, and are 0 for an empty generation.
 */
public record BreadthSummary(int longs, int shorts, int neutrals, int total,
                             double longPct, double shortPct, double neutralPct) {

    public static BreadthSummary of(int longs, int shorts, int neutrals) {
        int total = longs + shorts + neutrals;
        return new BreadthSummary(longs, shorts, neutrals, total,
                pct(longs, total), pct(shorts, total), pct(neutrals, total));
    }

    private static double pct(int count, int total) {
        if (total == 0) return 0.0;
        return count * 100.0 / total;
    }
}

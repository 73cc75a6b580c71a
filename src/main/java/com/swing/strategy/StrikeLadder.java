package com.swing.strategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps an underlying price to the strike step its option chain is quoted in.
 *
 * <p>Tiers are checked from the highest price floor down; the first floor the price
 * exceeds decides the step. The lowest tier applies to everything below.
 */
public final class StrikeLadder {

    /** 5000+ by 100, 1000+ by 50, 500+ by 20, otherwise 10. */
    public static final List<String> DEFAULT_TIERS = List.of("5000:100", "1000:50", "500:20", "0:10");

    private final List<Tier> tiers;

    public StrikeLadder(List<Tier> tiers) {
        if (tiers == null || tiers.isEmpty()) throw new IllegalArgumentException("At least one strike tier is required");
        List<Tier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingDouble(Tier::floor).reversed());
        this.tiers = List.copyOf(sorted);
    }

    /**
     * Parse {@code floor:step} tokens such as {@code "1000:50"}.
     */
    public static StrikeLadder parse(List<String> tokens) {
        List<Tier> tiers = new ArrayList<>();
        for (String token : tokens) {
            String[] parts = token.trim().split(":");
            if (parts.length != 2) throw new IllegalArgumentException("Strike tier must be floor:step, got " + token);
            tiers.add(new Tier(Double.parseDouble(parts[0].trim()), Integer.parseInt(parts[1].trim())));
        }
        return new StrikeLadder(tiers);
    }

    public static StrikeLadder defaults() {
        return parse(DEFAULT_TIERS);
    }

    public int stepFor(double price) {
        for (Tier tier : tiers) {
            if (price > tier.floor()) return tier.step();
        }
        return tiers.get(tiers.size() - 1).step();
    }

    /**
     * Nearest quoted strike, halves rounded up.
     */
    public long roundToStrike(double price) {
        int step = stepFor(price);
        return Math.round(price / step) * step;
    }

    public record Tier(double floor, int step) {

        public Tier {
            if (step <= 0) throw new IllegalArgumentException("Strike step must be positive");
        }
    }
}

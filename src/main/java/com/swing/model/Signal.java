package com.swing.model;

import java.util.List;

/**
 * Directional signal derived from an {@link IndicatorSet}.
 *
 * @param score      signed sum of the fired contributions
 * @param direction  LONG / SHORT / NEUTRAL, a function of score only
 * @param confidence 0..100, a function of |score| only
 * @param reasons    one human-readable line per fired contribution, in rule order
 */
public record Signal(double score, Direction direction, int confidence, List<String> reasons) {

    public Signal {
        if (direction == null) throw new IllegalArgumentException("Direction must not be null");
        if (confidence < 0 || confidence > 100) throw new IllegalArgumentException("Confidence must be within 0..100");
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}

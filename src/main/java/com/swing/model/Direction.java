package com.swing.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Directional label attached to a scored symbol.
 */
public enum Direction {

    LONG,
    SHORT,
    NEUTRAL;

    /**
     * Case-insensitive lookup, empty for unknown names.
     */
    public static Optional<Direction> fromName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(d -> d.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}

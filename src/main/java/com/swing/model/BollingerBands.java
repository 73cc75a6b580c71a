package com.swing.model;

/**
 * Latest Bollinger band levels.
 *
 * @param upper mid + k * stdev
 * @param mid   simple moving average over the band window
 * @param lower mid - k * stdev
 */
public record BollingerBands(double upper, double mid, double lower) {

    public BollingerBands {
        if (upper < lower) throw new IllegalArgumentException("Upper band must be >= lower band");
    }

    public double width() {
        return upper - lower;
    }

    /**
     * Normalised position of {@code price} between the bands, clamped to [0, 1].
     * A zero-width band has no meaningful position and reports the midpoint 0.5.
     */
    public double position(double price) {
        double width = width();
        if (width <= 0) return 0.5;
        double pos = (price - lower) / width;
        return Math.max(0.0, Math.min(1.0, pos));
    }
}

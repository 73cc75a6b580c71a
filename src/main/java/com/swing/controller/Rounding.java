package com.swing.controller;

/**
 * Two-decimal rounding applied to numbers on their way out of the API.
 */
final class Rounding {

    private Rounding() {
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static Double round(Double value) {
        return value == null ? null : round(value.doubleValue());
    }
}

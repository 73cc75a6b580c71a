package com.swing.model;

/**
 * Latest MACD reading.
 *
 * @param line      EMA12 - EMA26
 * @param signal    EMA9 of the MACD line, null while the line is too short for it
 * @param histogram line - signal, null whenever signal is
 */
public record MacdValue(double line, Double signal, Double histogram) {

    public static MacdValue lineOnly(double line) {
        return new MacdValue(line, null, null);
    }

    public boolean hasSignal() {
        return signal != null;
    }
}

package com.swing.indicator;

import com.swing.SignalServiceException;

/**
 * Thrown when a series is shorter than an indicator's minimum window.
 * Callers degrade that single indicator rather than the whole symbol.
 */
public class InsufficientHistoryException extends SignalServiceException {

    private final String indicator;
    private final int required;
    private final int available;

    public InsufficientHistoryException(String indicator, int required, int available) {
        super(indicator + " needs " + required + " points, series has " + available);
        this.indicator = indicator;
        this.required = required;
        this.available = available;
    }

    public String getIndicator() {
        return indicator;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}

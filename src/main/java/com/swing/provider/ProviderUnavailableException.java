package com.swing.provider;

import com.swing.SignalServiceException;

/**
 * Transient fetch failure for one symbol. The refresh keeps that symbol's previous
 * snapshot and carries on with the rest of the universe.
 */
public class ProviderUnavailableException extends SignalServiceException {

    private final String symbol;

    public ProviderUnavailableException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public ProviderUnavailableException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}

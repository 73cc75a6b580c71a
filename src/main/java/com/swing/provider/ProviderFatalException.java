package com.swing.provider;

import com.swing.SignalServiceException;

/**
 * Permanent failure for one symbol (unknown, delisted, no data). The symbol is left
 * out of the generation.
 */
public class ProviderFatalException extends SignalServiceException {

    private final String symbol;

    public ProviderFatalException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public ProviderFatalException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}

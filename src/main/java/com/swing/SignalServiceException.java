package com.swing;

/**
 * Root of the service's unchecked exceptions. Each subtype marks the scope a
 * failure is contained to: one indicator, one symbol, or one refresh.
 */
public class SignalServiceException extends RuntimeException {

    public SignalServiceException(String message) {
        super(message);
    }

    public SignalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.swing.cache;

import com.swing.SignalServiceException;

/**
 * A refresh obtained no fresh data at all. The previous generation stays in place
 * and the next trigger retries.
 */
public class RefreshFailedException extends SignalServiceException {

    public RefreshFailedException(String message) {
        super(message);
    }

    public RefreshFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

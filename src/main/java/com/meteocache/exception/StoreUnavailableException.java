package com.meteocache.exception;

/**
 * The backing store could not be reached, timed out, or rejected the operation.
 * Transient: callers may retry with backoff.
 */
public class StoreUnavailableException extends MeteoCacheException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return true;
    }
}

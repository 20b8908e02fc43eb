package com.meteocache.exception;

/**
 * A stored forecast could not be decoded with its declared encoding.
 */
public class ForecastDataCorruptedException extends StoreUnavailableException {
    public ForecastDataCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

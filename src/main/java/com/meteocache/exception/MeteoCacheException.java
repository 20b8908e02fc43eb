package com.meteocache.exception;

/**
 * Base type for all failures raised by the forecast cache engine.
 */
public class MeteoCacheException extends RuntimeException {
    public MeteoCacheException(String message) {
        super(message);
    }

    public MeteoCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}

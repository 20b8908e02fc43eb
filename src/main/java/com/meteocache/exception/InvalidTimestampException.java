package com.meteocache.exception;

public class InvalidTimestampException extends MeteoCacheException {
    public InvalidTimestampException(String message) {
        super(message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}

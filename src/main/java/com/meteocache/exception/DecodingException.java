package com.meteocache.exception;

public class DecodingException extends MeteoCacheException {
    public DecodingException(String message) {
        super(message);
    }

    public DecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

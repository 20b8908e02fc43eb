package com.meteocache.exception;

public class EncodingException extends MeteoCacheException {
    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

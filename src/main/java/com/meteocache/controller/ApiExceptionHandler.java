package com.meteocache.controller;

import com.meteocache.exception.EncodingException;
import com.meteocache.exception.InvalidTimestampException;
import com.meteocache.exception.StoreUnavailableException;
import com.meteocache.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 * Backing store failure details are logged and never returned to the caller.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String STORE_UNAVAILABLE_MESSAGE = "Forecast store is temporarily unavailable";

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.warn("Request failed, store unavailable (retryable={}): {}", e.isRetryable(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(STORE_UNAVAILABLE_MESSAGE));
    }

    @ExceptionHandler({
            EncodingException.class,
            InvalidTimestampException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Invalid value for parameter '" + e.getName() + "'"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Missing required parameter '" + e.getParameterName() + "'"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request body"));
    }
}

package com.gomesguardian.thesis.controller;

import com.gomesguardian.common.exception.ConcurrencyConflictException;
import com.gomesguardian.common.exception.InputRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the exception hierarchy to HTTP status codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InputRejectedException.class)
    public ResponseEntity<Map<String, String>> rejected(InputRejectedException e) {
        log.warn("Input rejected. component={} reason={}", e.getComponent(), e.getMessage());
        return ResponseEntity.badRequest()
            .body(Map.of("error", "INPUT_REJECTED", "component", e.getComponent(), "message", e.getMessage()));
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<Map<String, String>> conflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict after retries. ticker={} reason={}", e.getTicker(), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "CONCURRENCY_CONFLICT", "ticker", e.getTicker(), "message", e.getMessage()));
    }
}

package com.gomesguardian.common.exception;

/**
 * Malformed input: score out of range, inverted price lines, blank ticker.
 * Never retried.
 */
public class InputRejectedException extends GomesException {

    public InputRejectedException(String component, String message) {
        super(component, message);
    }
}

package com.gomesguardian.common.exception;

/**
 * A write lost the per-ticker race. Callers retry with freshly read state.
 */
public class ConcurrencyConflictException extends GomesException {
    private final String ticker;

    public ConcurrencyConflictException(String component, String ticker, String message) {
        super(component, message + " ticker=" + ticker);
        this.ticker = ticker;
    }

    public ConcurrencyConflictException(String component, String ticker, String message, Throwable cause) {
        super(component, message + " ticker=" + ticker, cause);
        this.ticker = ticker;
    }

    public String getTicker() {
        return ticker;
    }
}

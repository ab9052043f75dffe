package com.gomesguardian.common.exception;

/**
 * Root of the decision-core exception hierarchy. Carries the name of the rule
 * or component that raised it, prefixed to the message.
 */
public class GomesException extends RuntimeException {
    private final String component;

    public GomesException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public GomesException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}

package com.gomesguardian.common.drift;

/** Severity of a drift alert. Declaration order is the display priority. */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    OPPORTUNITY,
    INFO
}

package com.gomesguardian.common.synthesis;

/**
 * Severity of the contradiction between new information and a stored thesis.
 */
public enum ConflictType {
    NONE,
    MINOR,
    SIGNIFICANT,
    CRITICAL;

    public static final int CRITICAL_THRESHOLD    = -4;
    public static final int SIGNIFICANT_THRESHOLD = -2;

    /** Classifies a signed keyword total: ≤-4 CRITICAL, ≤-2 SIGNIFICANT, &lt;0 MINOR, else NONE. */
    public static ConflictType fromAdjustment(int total) {
        if (total <= CRITICAL_THRESHOLD)    return CRITICAL;
        if (total <= SIGNIFICANT_THRESHOLD) return SIGNIFICANT;
        if (total < 0)                      return MINOR;
        return NONE;
    }

    /** SIGNIFICANT and CRITICAL conflicts raise a drift alert. */
    public boolean raisesAlert() {
        return this == SIGNIFICANT || this == CRITICAL;
    }
}

package com.gomesguardian.common.model;

/**
 * Portfolio-wide market alert level. Ordered from least to most defensive.
 * Exactly one regime is current at any time; it is set by the operator.
 */
public enum MarketRegime {
    GREEN("OFFENSE", "Aggressive accumulation, full position sizes allowed"),
    YELLOW("SELECTIVE", "Only best ideas, raise some cash"),
    ORANGE("DEFENSE", "No new positions, tighten stops, reduce exposure"),
    RED("CASH IS KING", "Maximum defense, hedge heavily, no new longs");

    private final String mode;
    private final String description;

    MarketRegime(String mode, String description) {
        this.mode = mode;
        this.description = description;
    }

    public String mode() {
        return mode;
    }

    public String description() {
        return description;
    }

    /** True when {@code other} is strictly more defensive than this regime. */
    public boolean isEscalationTo(MarketRegime other) {
        return other != null && other.ordinal() > ordinal();
    }
}

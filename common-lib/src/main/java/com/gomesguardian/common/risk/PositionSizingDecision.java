package com.gomesguardian.common.risk;

/**
 * Output of {@link PositionSizingEngine#decide}.
 *
 * @param positionPct  recommended position as % of portfolio, in [0, tierCapPct]
 * @param rawKellyPct  half-Kelly size before the tier cap (after the volatility pass)
 * @param tierCapPct   hard ceiling that was applied
 * @param capped       true when the tier cap, not Kelly, determined the size
 * @param reasoning    factor breakdown for audit
 */
public record PositionSizingDecision(
    double  positionPct,
    double  rawKellyPct,
    double  tierCapPct,
    boolean capped,
    String  reasoning
) {
    /** Zero-size decision for an unfavorable or undefined edge. */
    public static PositionSizingDecision none(double tierCapPct, String reason) {
        return new PositionSizingDecision(0.0, 0.0, tierCapPct, false, reason);
    }
}

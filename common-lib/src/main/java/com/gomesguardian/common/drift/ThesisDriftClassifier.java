package com.gomesguardian.common.drift;

import com.gomesguardian.common.model.ConvictionScore;

/**
 * Classifies the delta between two successive conviction scores.
 *
 * <pre>
 *   delta ≤ −3    THESIS_BROKEN      CRITICAL      sell immediately, flag for review
 *   delta −2..−1  THESIS_DRIFT       WARNING       review position (new &lt; 5) / re-validate thesis
 *   delta 0       STABLE             no alert
 *   delta +1..+2  IMPROVEMENT        OPPORTUNITY when priced at/below green, else INFO
 *   delta ≥ +3    MAJOR_IMPROVEMENT  OPPORTUNITY   strong buy candidate
 * </pre>
 *
 * <p>A missing previous score is a first analysis and counts as delta 0.
 */
public final class ThesisDriftClassifier {

    public static final int BROKEN_DELTA = -3;
    public static final int MAJOR_IMPROVEMENT_DELTA = 3;
    public static final int REVIEW_POSITION_BELOW = 5;

    private ThesisDriftClassifier() {}

    /**
     * @param priceAtOrBelowGreen current price sits at or below the green line
     */
    public static ThesisDriftResult classify(String ticker, Integer previousScore, int newScore,
                                             boolean priceAtOrBelowGreen) {
        ConvictionScore.require(newScore, "ThesisDriftClassifier");
        if (previousScore != null) {
            ConvictionScore.require(previousScore, "ThesisDriftClassifier");
        }
        int delta = previousScore == null ? 0 : newScore - previousScore;
        String move = previousScore == null
            ? "Initial analysis complete"
            : String.format("Score moved %d → %d (%+d)", previousScore, newScore, delta);

        if (delta <= BROKEN_DELTA) {
            return new ThesisDriftResult(ticker, previousScore, newScore, delta,
                DriftLevel.THESIS_BROKEN, AlertSeverity.CRITICAL,
                "THESIS BROKEN: " + ticker, move,
                "SELL IMMEDIATELY. Thesis fundamentally broken.", true, false);
        }
        if (delta < 0) {
            String recommendation = newScore < REVIEW_POSITION_BELOW
                ? "REVIEW POSITION. Consider reducing exposure."
                : "RE-VALIDATE THESIS. Check whether the original edge still holds.";
            return new ThesisDriftResult(ticker, previousScore, newScore, delta,
                DriftLevel.THESIS_DRIFT, AlertSeverity.WARNING,
                "Thesis drift: " + ticker, move, recommendation, false, false);
        }
        if (delta == 0) {
            return new ThesisDriftResult(ticker, previousScore, newScore, 0,
                DriftLevel.STABLE, null, "Stable: " + ticker, move, null, false, false);
        }
        if (delta < MAJOR_IMPROVEMENT_DELTA) {
            return priceAtOrBelowGreen
                ? new ThesisDriftResult(ticker, previousScore, newScore, delta,
                    DriftLevel.IMPROVEMENT, AlertSeverity.OPPORTUNITY,
                    "Improving thesis in buy zone: " + ticker, move,
                    "CONSIDER ADDING. Thesis improving while priced in the buy zone.", false, false)
                : new ThesisDriftResult(ticker, previousScore, newScore, delta,
                    DriftLevel.IMPROVEMENT, AlertSeverity.INFO,
                    "Improving thesis: " + ticker, move,
                    "THESIS STRENGTHENING. Wait for a buy-zone entry.", false, false);
        }
        return new ThesisDriftResult(ticker, previousScore, newScore, delta,
            DriftLevel.MAJOR_IMPROVEMENT, AlertSeverity.OPPORTUNITY,
            "MAJOR UPGRADE: " + ticker, move,
            "MAJOR UPGRADE! Strong buy candidate.", false, false);
    }
}

package com.gomesguardian.common.lifecycle;

import com.gomesguardian.common.model.ConvictionScore;
import com.gomesguardian.common.model.LifecyclePhase;
import com.gomesguardian.common.model.ZoneSignal;

/**
 * Classifies a ticker's lifecycle phase. First matching rule wins:
 *
 * <pre>
 *   cash runway &lt; 6 months                         → DECLINE
 *   score ≥ 8 and recent catalyst                   → ACTIVE_GOLD_MINE
 *   score ≥ 8 and next catalyst within 90 days      → GREAT_FIND
 *   score ≥ 8                                       → WAIT_TIME
 *   score 5..7                                      → WAIT_TIME
 *   score &lt; 5                                       → DECLINE
 * </pre>
 *
 * <p>An unknown cash runway skips the solvency rule; an unknown next catalyst
 * never counts as near. HARVEST is not derived from the score: see
 * {@link #refineForZone}.
 */
public final class LifecycleClassifier {

    /** Runway below which solvency risk overrides any narrative. */
    public static final int MIN_CASH_RUNWAY_MONTHS = 6;

    public static final int HIGH_CONVICTION_SCORE = 8;
    public static final int MIN_HOLD_SCORE = 5;

    /** Horizon within which an upcoming catalyst makes a great find. */
    public static final int CATALYST_HORIZON_DAYS = 90;

    private LifecycleClassifier() {}

    public static LifecyclePhase classify(int score, boolean hasRecentCatalyst,
                                          Integer daysToNextCatalyst, Integer cashRunwayMonths) {
        ConvictionScore.require(score, "LifecycleClassifier");

        if (isSolvencyRisk(cashRunwayMonths)) {
            return LifecyclePhase.DECLINE;
        }
        if (score >= HIGH_CONVICTION_SCORE) {
            if (hasRecentCatalyst) {
                return LifecyclePhase.ACTIVE_GOLD_MINE;
            }
            if (daysToNextCatalyst != null && daysToNextCatalyst >= 0
                    && daysToNextCatalyst <= CATALYST_HORIZON_DAYS) {
                return LifecyclePhase.GREAT_FIND;
            }
            return LifecyclePhase.WAIT_TIME;
        }
        if (score >= MIN_HOLD_SCORE) {
            return LifecyclePhase.WAIT_TIME;
        }
        return LifecyclePhase.DECLINE;
    }

    /**
     * A held ticker priced into its sell zone is being harvested, unless it is
     * already in decline.
     */
    public static LifecyclePhase refineForZone(LifecyclePhase phase, ZoneSignal zone, boolean held) {
        if (held && zone != null && zone.isSellSide() && phase != LifecyclePhase.DECLINE) {
            return LifecyclePhase.HARVEST;
        }
        return phase;
    }

    public static boolean isSolvencyRisk(Integer cashRunwayMonths) {
        return cashRunwayMonths != null && cashRunwayMonths < MIN_CASH_RUNWAY_MONTHS;
    }
}

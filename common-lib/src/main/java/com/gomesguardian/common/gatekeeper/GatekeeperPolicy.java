package com.gomesguardian.common.gatekeeper;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.MarketRegime;
import com.gomesguardian.common.regime.MarketAlertSystem;
import com.gomesguardian.common.risk.PositionSizingEngine;

/**
 * Tunable constants of {@link GomesGatekeeper}.
 *
 * @param earningsBlackoutDays            days before earnings during which entries are blocked
 * @param assumeEarningsImminentWhenUnknown block when the earnings date is missing or stale
 * @param minExpectedLossPct              floor of the Kelly loss leg, in percent
 * @param volatilityThreshold             trailing volatility above which Kelly size decays
 * @param mlFusionWeight                  weight of a model prediction when blended into confidence
 */
public record GatekeeperPolicy(
    int     earningsBlackoutDays,
    boolean assumeEarningsImminentWhenUnknown,
    double  greenCapMultiplier,
    double  yellowCapMultiplier,
    double  orangeCapMultiplier,
    double  redOverrideCapMultiplier,
    double  minExpectedLossPct,
    double  volatilityThreshold,
    double  mlFusionWeight
) {
    public static final int DEFAULT_EARNINGS_BLACKOUT_DAYS = 14;
    public static final double DEFAULT_MIN_EXPECTED_LOSS_PCT = 10.0;
    public static final double DEFAULT_ML_FUSION_WEIGHT = 0.2;

    public GatekeeperPolicy {
        if (earningsBlackoutDays < 0) {
            throw new InputRejectedException("GatekeeperPolicy", "earnings blackout days must be >= 0");
        }
        if (mlFusionWeight < 0 || mlFusionWeight > 1) {
            throw new InputRejectedException("GatekeeperPolicy", "ml fusion weight must be in [0,1]");
        }
        requireMultiplier(greenCapMultiplier);
        requireMultiplier(yellowCapMultiplier);
        requireMultiplier(orangeCapMultiplier);
        requireMultiplier(redOverrideCapMultiplier);
    }

    public static GatekeeperPolicy defaults() {
        return new GatekeeperPolicy(
            DEFAULT_EARNINGS_BLACKOUT_DAYS,
            true,
            MarketAlertSystem.GREEN_CAP_MULTIPLIER,
            MarketAlertSystem.YELLOW_CAP_MULTIPLIER,
            MarketAlertSystem.ORANGE_CAP_MULTIPLIER,
            MarketAlertSystem.RED_OVERRIDE_CAP_MULTIPLIER,
            DEFAULT_MIN_EXPECTED_LOSS_PCT,
            PositionSizingEngine.DEFAULT_VOLATILITY_THRESHOLD,
            DEFAULT_ML_FUSION_WEIGHT);
    }

    public double capMultiplier(MarketRegime regime) {
        return switch (MarketAlertSystem.orDefault(regime)) {
            case GREEN  -> greenCapMultiplier;
            case YELLOW -> yellowCapMultiplier;
            case ORANGE -> orangeCapMultiplier;
            case RED    -> redOverrideCapMultiplier;
        };
    }

    /**
     * Maps a conviction score to a win probability: {@code score / 10}, blended with
     * an upward model prediction when one is present.
     */
    public double confidence(int score, Double mlUpConfidence) {
        double gomes = score / 10.0;
        if (mlUpConfidence == null || mlFusionWeight == 0) {
            return gomes;
        }
        double ml = Math.max(0.0, Math.min(1.0, mlUpConfidence));
        return (1 - mlFusionWeight) * gomes + mlFusionWeight * ml;
    }

    private static void requireMultiplier(double multiplier) {
        if (multiplier < 0 || multiplier > 1) {
            throw new InputRejectedException("GatekeeperPolicy", "cap multiplier must be in [0,1], got " + multiplier);
        }
    }
}

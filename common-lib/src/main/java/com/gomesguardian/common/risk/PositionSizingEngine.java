package com.gomesguardian.common.risk;

import com.gomesguardian.common.exception.InputRejectedException;

/**
 * Half-Kelly position sizing bounded by a conviction tier cap.
 *
 * <h3>Formula</h3>
 * <pre>
 *   p = confidence, q = 1 − p, b = expectedGain / expectedLoss
 *   f = (b·p − q) / b
 *   size% = clamp(f × {@value #KELLY_FRACTION} × 100, 0, tierCap%)
 * </pre>
 *
 * <p>Returns 0 when {@code confidence ≤ 0.5}, {@code expectedGain ≤ 0} or
 * {@code expectedLoss ≤ 0}: the formula is only meaningful for a favorable,
 * bounded edge.
 *
 * <h3>Volatility pass (optional)</h3>
 * <pre>
 *   vol &gt; threshold → f × exp(−(vol − threshold) × {@value #VOLATILITY_DECAY_RATE})
 * </pre>
 * The multiplier is always below 1, so the pass never increases size.
 *
 * <p>Stateless, pure, and thread-safe.
 */
public final class PositionSizingEngine {

    /** Safety multiplier applied to the raw Kelly fraction. */
    public static final double KELLY_FRACTION = 0.5;

    /** Default trailing-volatility threshold above which size decays. */
    public static final double DEFAULT_VOLATILITY_THRESHOLD = 0.05;

    /** Exponential decay rate of the volatility pass. */
    public static final double VOLATILITY_DECAY_RATE = 10.0;

    private PositionSizingEngine() {}

    /**
     * @param confidence      win probability in [0,1]
     * @param expectedGainPct expected upside in percent
     * @param expectedLossPct expected downside in percent (positive number)
     * @param tierCapPct      hard ceiling in percent of portfolio
     * @return size in percent of portfolio, in [0, tierCapPct]
     */
    public static double size(double confidence, double expectedGainPct,
                              double expectedLossPct, double tierCapPct) {
        return decide(confidence, expectedGainPct, expectedLossPct, tierCapPct, null,
                      DEFAULT_VOLATILITY_THRESHOLD).positionPct();
    }

    /**
     * Full sizing decision with optional volatility pass.
     *
     * @param trailingVolatility trailing volatility as a fraction; null skips the pass
     * @param volatilityThreshold volatility above which size decays
     */
    public static PositionSizingDecision decide(double confidence, double expectedGainPct,
                                                double expectedLossPct, double tierCapPct,
                                                Double trailingVolatility,
                                                double volatilityThreshold) {
        if (!(confidence > 0.5)) {
            return PositionSizingDecision.none(tierCapPct,
                String.format("conf=%.2f≤0.50 → no edge", confidence));
        }
        if (confidence > 1.0) {
            throw new InputRejectedException("PositionSizing", "confidence must be in [0,1], got " + confidence);
        }
        if (!(tierCapPct >= 0)) {
            throw new InputRejectedException("PositionSizing", "tier cap must be non-negative, got " + tierCapPct);
        }
        if (!(expectedGainPct > 0)) {
            return PositionSizingDecision.none(tierCapPct,
                String.format("gain=%.2f%%≤0 → no edge", expectedGainPct));
        }
        if (!(expectedLossPct > 0)) {
            return PositionSizingDecision.none(tierCapPct,
                String.format("loss=%.2f%%≤0 → downside undefined", expectedLossPct));
        }

        double b = expectedGainPct / expectedLossPct;
        double q = 1.0 - confidence;
        double rawKelly = (b * confidence - q) / b;
        double halfKellyPct = Math.max(0.0, rawKelly * KELLY_FRACTION) * 100.0;

        double volFactor = volatilityFactor(trailingVolatility, volatilityThreshold);
        double kellyPct  = halfKellyPct * volFactor;
        boolean capped  = kellyPct > tierCapPct;
        double position = Math.min(kellyPct, tierCapPct);

        String reasoning = String.format(
            "conf=%.2f b=%.3f kelly=%.4f half=%.2f%% vol×%.3f cap=%.2f%% → %.2f%%",
            confidence, b, rawKelly, halfKellyPct, volFactor, tierCapPct, position);

        return new PositionSizingDecision(position, kellyPct, tierCapPct, capped, reasoning);
    }

    /**
     * Sizing from a price prediction: gain is the predicted move, loss the stop distance.
     *
     * @param stopLossPct stop distance in percent below the current price
     */
    public static double fromPrediction(double confidence, double currentPrice, double predictedPrice,
                                        double stopLossPct, double tierCapPct) {
        if (!(currentPrice > 0)) {
            return 0.0;
        }
        double gainPct = (predictedPrice - currentPrice) / currentPrice * 100.0;
        return size(confidence, gainPct, stopLossPct, tierCapPct);
    }

    /**
     * Multiplier of the volatility pass, in (0, 1].
     */
    public static double volatilityFactor(Double trailingVolatility, double threshold) {
        if (trailingVolatility == null || !(trailingVolatility > threshold)) {
            return 1.0;
        }
        return Math.exp(-(trailingVolatility - threshold) * VOLATILITY_DECAY_RATE);
    }
}

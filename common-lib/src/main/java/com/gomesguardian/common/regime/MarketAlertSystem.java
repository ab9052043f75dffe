package com.gomesguardian.common.regime;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.MarketRegime;

/**
 * Rules attached to the global market regime.
 *
 * <h3>Effect on the gatekeeper</h3>
 * <pre>
 *   GREEN   tier cap × {@value #GREEN_CAP_MULTIPLIER}
 *   YELLOW  tier cap × {@value #YELLOW_CAP_MULTIPLIER}
 *   ORANGE  tier cap × {@value #ORANGE_CAP_MULTIPLIER}
 *   RED     new entries → AVOID; with operator override tier cap × {@value #RED_OVERRIDE_CAP_MULTIPLIER}
 * </pre>
 *
 * <p>Transitions are explicit operator writes and any regime may follow any other.
 * When nothing was ever set, {@link #DEFAULT_REGIME} is current.
 */
public final class MarketAlertSystem {

    public static final MarketRegime DEFAULT_REGIME = MarketRegime.YELLOW;

    public static final double GREEN_CAP_MULTIPLIER        = 1.0;
    public static final double YELLOW_CAP_MULTIPLIER       = 1.0;
    public static final double ORANGE_CAP_MULTIPLIER       = 0.5;
    public static final double RED_OVERRIDE_CAP_MULTIPLIER = 0.25;

    /** Inverse small-cap ETF used as the hedge leg. */
    public static final String HEDGE_TICKER = "RWM";

    private MarketAlertSystem() {}

    public static double capMultiplier(MarketRegime regime) {
        return switch (orDefault(regime)) {
            case GREEN  -> GREEN_CAP_MULTIPLIER;
            case YELLOW -> YELLOW_CAP_MULTIPLIER;
            case ORANGE -> ORANGE_CAP_MULTIPLIER;
            case RED    -> RED_OVERRIDE_CAP_MULTIPLIER;
        };
    }

    /** RED blocks new entries unless the operator explicitly overrides. */
    public static boolean blocksNewEntries(MarketRegime regime, boolean override) {
        return orDefault(regime) == MarketRegime.RED && !override;
    }

    /** Speculative, low-conviction entries are only tolerated in GREEN. */
    public static boolean allowsSpeculative(MarketRegime regime) {
        return orDefault(regime) == MarketRegime.GREEN;
    }

    public static MarketAllocation allocation(MarketRegime regime) {
        return switch (orDefault(regime)) {
            case GREEN  -> new MarketAllocation(100, 0, 0, HEDGE_TICKER);
            case YELLOW -> new MarketAllocation(75, 15, 10, HEDGE_TICKER);
            case ORANGE -> new MarketAllocation(25, 35, 40, HEDGE_TICKER);
            case RED    -> new MarketAllocation(5, 45, 50, HEDGE_TICKER);
        };
    }

    /**
     * Validates an operator write and describes it for the regime log.
     *
     * @param current the current regime, null when none was ever set
     */
    public static RegimeTransition transition(MarketRegime current, MarketRegime next, String note) {
        if (next == null) {
            throw new InputRejectedException("MarketAlertSystem", "new regime is required");
        }
        boolean escalation = current != null && current.isEscalationTo(next);
        return new RegimeTransition(current, next, note, escalation);
    }

    public static MarketRegime orDefault(MarketRegime regime) {
        return regime != null ? regime : DEFAULT_REGIME;
    }
}

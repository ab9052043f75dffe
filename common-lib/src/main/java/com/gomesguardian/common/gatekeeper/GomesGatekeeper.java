package com.gomesguardian.common.gatekeeper;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.lifecycle.LifecycleClassifier;
import com.gomesguardian.common.model.ConvictionScore;
import com.gomesguardian.common.model.LifecyclePhase;
import com.gomesguardian.common.model.MarketRegime;
import com.gomesguardian.common.model.TickerSnapshot;
import com.gomesguardian.common.model.TradingZone;
import com.gomesguardian.common.model.Verdict;
import com.gomesguardian.common.model.VerdictDecision;
import com.gomesguardian.common.model.ZoneSignal;
import com.gomesguardian.common.regime.MarketAlertSystem;
import com.gomesguardian.common.risk.PositionSizingDecision;
import com.gomesguardian.common.risk.PositionSizingEngine;
import com.gomesguardian.common.risk.TierCapTable;
import com.gomesguardian.common.zone.TradingZoneEngine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Synthesizes regime, lifecycle, zone and sizing into one {@link Verdict}.
 *
 * <h3>Gate order (each gate may short-circuit)</h3>
 * <ol>
 *   <li>Compliance: earnings within the blackout window → BLOCKED {@code EARNINGS_BLACKOUT}.
 *       A missing or past earnings date is treated as imminent
 *       ({@code EARNINGS_DATE_UNKNOWN} / {@code EARNINGS_DATE_STALE}).</li>
 *   <li>RED regime without operator override → AVOID.</li>
 *   <li>Lifecycle phase and trading zone; STRONG_SELL on a held ticker flags {@code SELL_ZONE}.</li>
 *   <li>Tier cap from the conviction score, dampened by the regime.
 *       A cash runway under six months zeroes the cap ({@code SOLVENCY_RISK}).</li>
 *   <li>Half-Kelly size from score-derived confidence, upside to the red line as gain and
 *       distance to the green line (floored) as loss; {@code min(kelly, cap)}.</li>
 *   <li>Size 0 → AVOID, otherwise ALLOW.</li>
 * </ol>
 *
 * <p>Evaluation performs no I/O and reads no clock: identical snapshots produce
 * equal verdicts. Instances are immutable and thread-safe.
 */
public final class GomesGatekeeper {

    public static final String EARNINGS_BLACKOUT     = "EARNINGS_BLACKOUT";
    public static final String EARNINGS_DATE_UNKNOWN = "EARNINGS_DATE_UNKNOWN";
    public static final String EARNINGS_DATE_STALE   = "EARNINGS_DATE_STALE";

    public static final String RISK_MARKET_RED     = "MARKET_RED_ALERT";
    public static final String RISK_SELL_ZONE      = "SELL_ZONE";
    public static final String RISK_SOLVENCY       = "SOLVENCY_RISK";
    public static final String RISK_NO_PRICE_LINES = "NO_PRICE_LINES";
    public static final String RISK_DEAD_MONEY     = "DEAD_MONEY";

    private static final String COMPONENT = "GomesGatekeeper";

    private final GatekeeperPolicy policy;

    public GomesGatekeeper(GatekeeperPolicy policy) {
        this.policy = policy != null ? policy : GatekeeperPolicy.defaults();
    }

    public GatekeeperPolicy policy() {
        return policy;
    }

    /**
     * @throws InputRejectedException when the ticker, thesis or evaluation date is
     *         missing or the conviction score is out of range
     */
    public Verdict evaluate(TickerSnapshot snapshot) {
        validate(snapshot);

        String ticker = normalizeTicker(snapshot.ticker());
        int score = snapshot.thesis().convictionScore();
        MarketRegime regime = MarketAlertSystem.orDefault(snapshot.regime());

        TradingZone zone = TradingZoneEngine.computeZone(snapshot.currentPrice(), snapshot.priceLines());
        ZoneSignal signal = zone.signal();
        LifecyclePhase phase = LifecycleClassifier.refineForZone(
            LifecycleClassifier.classify(score, snapshot.hasRecentCatalyst(),
                                         snapshot.daysToNextCatalyst(), snapshot.cashRunwayMonths()),
            signal, snapshot.held());

        // Gate 1: compliance circuit breaker
        String blockedReason = earningsBlock(snapshot.earningsDate(), snapshot.asOf());
        if (blockedReason != null) {
            return new Verdict(ticker, VerdictDecision.BLOCKED, score, 0.0, phase, signal, regime,
                List.of(blockedReason), blockedReason, 0.0, 0.0, snapshot.asOf(),
                String.format("BLOCKED by %s earnings=%s asOf=%s window=%dd",
                    blockedReason, snapshot.earningsDate(), snapshot.asOf(), policy.earningsBlackoutDays()));
        }

        // Gate 2: regime
        if (MarketAlertSystem.blocksNewEntries(regime, snapshot.regimeOverride())) {
            return new Verdict(ticker, VerdictDecision.AVOID, score, 0.0, phase, signal, regime,
                List.of(RISK_MARKET_RED), null, 0.0, 0.0, snapshot.asOf(),
                "AVOID: market regime RED (" + regime.mode() + "), no override");
        }

        // Gate 3: zone flags
        List<String> riskFactors = new ArrayList<>();
        if (signal == ZoneSignal.STRONG_SELL && snapshot.held()) {
            riskFactors.add(RISK_SELL_ZONE);
        }
        if (!zone.hasData()) {
            riskFactors.add(RISK_NO_PRICE_LINES);
        }
        if (phase == LifecyclePhase.WAIT_TIME) {
            riskFactors.add(RISK_DEAD_MONEY);
        }

        // Gate 4: tier cap
        double tierCap = TierCapTable.capPct(score) * policy.capMultiplier(regime);
        if (LifecycleClassifier.isSolvencyRisk(snapshot.cashRunwayMonths())) {
            riskFactors.add(RISK_SOLVENCY);
            tierCap = 0.0;
        }

        // Gate 5: Kelly
        double confidence = policy.confidence(score, snapshot.mlUpConfidence());
        PositionSizingDecision sizing = zone.hasData()
            ? PositionSizingEngine.decide(confidence,
                zone.upsideToCeilingPct(),
                Math.max(zone.riskToFloorPct(), policy.minExpectedLossPct()),
                tierCap,
                snapshot.trailingVolatility(),
                policy.volatilityThreshold())
            : PositionSizingDecision.none(tierCap, "no zone data");

        double maxPositionPct = roundDown2(sizing.positionPct());

        // Gate 6: decision
        VerdictDecision decision = maxPositionPct > 0 ? VerdictDecision.ALLOW : VerdictDecision.AVOID;

        String explanation = String.format(
            "%s score=%d phase=%s zone=%s regime=%s cap=%.2f%% | %s",
            decision, score, phase, signal != null ? signal : "NO_DATA", regime, tierCap, sizing.reasoning());

        return new Verdict(ticker, decision, score, maxPositionPct, phase, signal, regime,
            riskFactors, null, tierCap, sizing.rawKellyPct(), snapshot.asOf(), explanation);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private String earningsBlock(LocalDate earningsDate, LocalDate asOf) {
        if (earningsDate == null) {
            return policy.assumeEarningsImminentWhenUnknown() ? EARNINGS_DATE_UNKNOWN : null;
        }
        long days = ChronoUnit.DAYS.between(asOf, earningsDate);
        if (days < 0) {
            return policy.assumeEarningsImminentWhenUnknown() ? EARNINGS_DATE_STALE : null;
        }
        return days <= policy.earningsBlackoutDays() ? EARNINGS_BLACKOUT : null;
    }

    private static void validate(TickerSnapshot snapshot) {
        if (snapshot == null) {
            throw new InputRejectedException(COMPONENT, "snapshot is required");
        }
        if (snapshot.ticker() == null || snapshot.ticker().isBlank()) {
            throw new InputRejectedException(COMPONENT, "ticker is required");
        }
        if (snapshot.thesis() == null) {
            throw new InputRejectedException(COMPONENT, "thesis is required for " + snapshot.ticker());
        }
        if (snapshot.asOf() == null) {
            throw new InputRejectedException(COMPONENT, "evaluation date is required");
        }
        ConvictionScore.require(snapshot.thesis().convictionScore(), COMPONENT);
    }

    public static String normalizeTicker(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    // Rounded down so the reported size can never exceed the cap.
    private static double roundDown2(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.DOWN).doubleValue();
    }
}

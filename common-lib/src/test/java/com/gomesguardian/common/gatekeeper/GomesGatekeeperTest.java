package com.gomesguardian.common.gatekeeper;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.LifecyclePhase;
import com.gomesguardian.common.model.MarketRegime;
import com.gomesguardian.common.model.PriceLines;
import com.gomesguardian.common.model.ThesisView;
import com.gomesguardian.common.model.TickerSnapshot;
import com.gomesguardian.common.model.Verdict;
import com.gomesguardian.common.model.VerdictDecision;
import com.gomesguardian.common.model.ZoneSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scenario tests for {@link GomesGatekeeper}. Baseline: score 8, YELLOW, lines 10/20,
 * price 9.50, earnings 50 days out.
 */
class GomesGatekeeperTest {

    private static final LocalDate AS_OF = LocalDate.of(2026, 1, 10);

    private final GomesGatekeeper gatekeeper = new GomesGatekeeper(GatekeeperPolicy.defaults());

    // ── scenarios ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("happy path")
    class HappyPath {

        @Test
        @DisplayName("score 8 below green in YELLOW → ALLOW capped at 12%")
        void allowCapped() {
            Verdict v = gatekeeper.evaluate(snapshot().build());

            assertEquals(VerdictDecision.ALLOW, v.decision());
            assertEquals(12.0, v.maxPositionPct(), 1e-9);
            assertEquals(12.0, v.tierCapPct(), 1e-9);
            assertTrue(v.kellyPct() > 12.0);
            assertEquals(ZoneSignal.AGGRESSIVE_BUY, v.zoneSignal());
            assertEquals(8, v.gomesScore());
            assertEquals(MarketRegime.YELLOW, v.regime());
            assertNull(v.blockedReason());
            assertEquals(AS_OF, v.evaluatedOn());
        }

        @Test
        @DisplayName("no catalyst timing known → WAIT_TIME flagged DEAD_MONEY but still sized")
        void deadMoney() {
            Verdict v = gatekeeper.evaluate(snapshot().build());
            assertEquals(LifecyclePhase.WAIT_TIME, v.lifecyclePhase());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.RISK_DEAD_MONEY));
        }

        @Test
        @DisplayName("catalyst 30 days out → GREAT_FIND without DEAD_MONEY")
        void greatFind() {
            Verdict v = gatekeeper.evaluate(snapshot().daysToNextCatalyst(30).build());
            assertEquals(LifecyclePhase.GREAT_FIND, v.lifecyclePhase());
            assertTrue(v.riskFactors().isEmpty());
        }

        @Test
        @DisplayName("ticker is normalized to upper case")
        void normalizesTicker() {
            assertEquals("ABC", gatekeeper.evaluate(snapshot().ticker("  abc ").build()).ticker());
        }

        @Test
        @DisplayName("identical snapshot → equal verdict")
        void deterministic() {
            TickerSnapshot s = snapshot().volatility(0.12).mlUp(0.7).build();
            assertEquals(gatekeeper.evaluate(s), gatekeeper.evaluate(s));
        }
    }

    @Nested
    @DisplayName("Gate 1: earnings blackout")
    class Earnings {

        @Test
        @DisplayName("earnings in 5 days → BLOCKED, even at score 10")
        void blackoutOverridesConviction() {
            Verdict v = gatekeeper.evaluate(snapshot().score(10).earnings(AS_OF.plusDays(5)).build());

            assertEquals(VerdictDecision.BLOCKED, v.decision());
            assertEquals(0.0, v.maxPositionPct());
            assertEquals(GomesGatekeeper.EARNINGS_BLACKOUT, v.blockedReason());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.EARNINGS_BLACKOUT));
        }

        @Test
        @DisplayName("window is inclusive: 14 days → BLOCKED, 15 days → ALLOW")
        void windowBoundary() {
            assertEquals(VerdictDecision.BLOCKED,
                gatekeeper.evaluate(snapshot().earnings(AS_OF.plusDays(14)).build()).decision());
            assertEquals(VerdictDecision.ALLOW,
                gatekeeper.evaluate(snapshot().earnings(AS_OF.plusDays(15)).build()).decision());
        }

        @Test
        @DisplayName("earnings today → BLOCKED")
        void earningsToday() {
            assertEquals(VerdictDecision.BLOCKED, gatekeeper.evaluate(snapshot().earnings(AS_OF).build()).decision());
        }

        @Test
        @DisplayName("unknown earnings date → BLOCKED as imminent")
        void unknown() {
            Verdict v = gatekeeper.evaluate(snapshot().earnings(null).build());
            assertEquals(VerdictDecision.BLOCKED, v.decision());
            assertEquals(GomesGatekeeper.EARNINGS_DATE_UNKNOWN, v.blockedReason());
        }

        @Test
        @DisplayName("earnings date in the past → BLOCKED as stale")
        void stale() {
            Verdict v = gatekeeper.evaluate(snapshot().earnings(AS_OF.minusDays(3)).build());
            assertEquals(GomesGatekeeper.EARNINGS_DATE_STALE, v.blockedReason());
        }

        @Test
        @DisplayName("policy not assuming imminent → unknown date passes")
        void lenientPolicy() {
            GatekeeperPolicy lenient = new GatekeeperPolicy(14, false, 1, 1, 0.5, 0.25, 10, 0.05, 0.2);
            Verdict v = new GomesGatekeeper(lenient).evaluate(snapshot().earnings(null).build());
            assertEquals(VerdictDecision.ALLOW, v.decision());
        }
    }

    @Nested
    @DisplayName("Gate 2: market regime")
    class Regime {

        @Test
        @DisplayName("RED without override → AVOID with MARKET_RED_ALERT")
        void redAvoids() {
            Verdict v = gatekeeper.evaluate(snapshot().score(10).regime(MarketRegime.RED).build());
            assertEquals(VerdictDecision.AVOID, v.decision());
            assertEquals(0.0, v.maxPositionPct());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.RISK_MARKET_RED));
        }

        @Test
        @DisplayName("RED with override → cap quartered (12% → 3%)")
        void redOverride() {
            Verdict v = gatekeeper.evaluate(snapshot().regime(MarketRegime.RED).override(true).build());
            assertEquals(VerdictDecision.ALLOW, v.decision());
            assertEquals(3.0, v.maxPositionPct(), 1e-9);
        }

        @Test
        @DisplayName("ORANGE → cap halved (12% → 6%)")
        void orangeHalves() {
            Verdict v = gatekeeper.evaluate(snapshot().regime(MarketRegime.ORANGE).build());
            assertEquals(6.0, v.tierCapPct(), 1e-9);
            assertEquals(6.0, v.maxPositionPct(), 1e-9);
        }

        @Test
        @DisplayName("missing regime → treated as YELLOW")
        void missingRegime() {
            assertEquals(MarketRegime.YELLOW, gatekeeper.evaluate(snapshot().regime(null).build()).regime());
        }
    }

    @Nested
    @DisplayName("Gates 3–6: zone, cap, Kelly")
    class Sizing {

        @Test
        @DisplayName("held above red → STRONG_SELL, HARVEST, SELL_ZONE, AVOID")
        void heldAboveRed() {
            Verdict v = gatekeeper.evaluate(snapshot().price(25.0).held(true).build());
            assertEquals(ZoneSignal.STRONG_SELL, v.zoneSignal());
            assertEquals(LifecyclePhase.HARVEST, v.lifecyclePhase());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.RISK_SELL_ZONE));
            assertEquals(VerdictDecision.AVOID, v.decision());
        }

        @Test
        @DisplayName("no price lines → AVOID with NO_PRICE_LINES")
        void noLines() {
            Verdict v = gatekeeper.evaluate(snapshot().lines(null).build());
            assertEquals(VerdictDecision.AVOID, v.decision());
            assertNull(v.zoneSignal());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.RISK_NO_PRICE_LINES));
        }

        @Test
        @DisplayName("price far below an astronomically high red line → AVOID, no exception")
        void overflowingZone() {
            Verdict v = assertDoesNotThrow(() -> gatekeeper.evaluate(
                snapshot().lines(PriceLines.of(1.0, 1e304)).price(1e-5).build()));
            assertEquals(VerdictDecision.AVOID, v.decision());
            assertEquals(0.0, v.maxPositionPct());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.RISK_NO_PRICE_LINES));
        }

        @Test
        @DisplayName("cash runway 3 months → DECLINE, SOLVENCY_RISK, AVOID")
        void solvency() {
            Verdict v = gatekeeper.evaluate(snapshot().score(9).runway(3).build());
            assertEquals(LifecyclePhase.DECLINE, v.lifecyclePhase());
            assertTrue(v.riskFactors().contains(GomesGatekeeper.RISK_SOLVENCY));
            assertEquals(0.0, v.tierCapPct());
            assertEquals(VerdictDecision.AVOID, v.decision());
        }

        @Test
        @DisplayName("score 5 → confidence 0.5, no edge → AVOID")
        void coinFlip() {
            Verdict v = gatekeeper.evaluate(snapshot().score(5).build());
            assertEquals(VerdictDecision.AVOID, v.decision());
            assertEquals(0.0, v.maxPositionPct());
        }

        @Test
        @DisplayName("score 6 → capped at the 5% tier")
        void scoreSix() {
            assertEquals(5.0, gatekeeper.evaluate(snapshot().score(6).build()).maxPositionPct(), 1e-9);
        }

        @Test
        @DisplayName("size never exceeds the tier cap")
        void neverAboveCap() {
            for (int score = 1; score <= 10; score++) {
                for (double price = 5.0; price <= 25.0; price += 0.5) {
                    Verdict v = gatekeeper.evaluate(snapshot().score(score).price(price).build());
                    assertTrue(v.maxPositionPct() <= v.tierCapPct(), "score=" + score + " price=" + price);
                    assertTrue(v.maxPositionPct() >= 0.0);
                    if (v.decision() != VerdictDecision.ALLOW) {
                        assertEquals(0.0, v.maxPositionPct());
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("input validation")
    class Validation {

        @Test
        @DisplayName("missing thesis → rejected")
        void missingThesis() {
            TickerSnapshot s = new TickerSnapshot("ABC", MarketRegime.GREEN, null, PriceLines.of(10.0, 20.0),
                9.5, AS_OF, AS_OF.plusDays(50), false, false, false, null, null, null, null);
            assertThrows(InputRejectedException.class, () -> gatekeeper.evaluate(s));
        }

        @Test
        @DisplayName("blank ticker → rejected")
        void blankTicker() {
            assertThrows(InputRejectedException.class, () -> gatekeeper.evaluate(snapshot().ticker(" ").build()));
        }

        @Test
        @DisplayName("score 11 → rejected")
        void scoreOutOfRange() {
            assertThrows(InputRejectedException.class, () -> gatekeeper.evaluate(snapshot().score(11).build()));
        }
    }

    @Test
    @DisplayName("GatekeeperPolicy.confidence(): score/10, blended 80/20 with a model prediction")
    void confidenceFusion() {
        GatekeeperPolicy policy = GatekeeperPolicy.defaults();
        assertEquals(0.8, policy.confidence(8, null), 1e-12);
        assertEquals(0.84, policy.confidence(8, 1.0), 1e-12);
        assertThrows(InputRejectedException.class,
            () -> new GatekeeperPolicy(14, true, 1.5, 1, 0.5, 0.25, 10, 0.05, 0.2));
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static SnapshotBuilder snapshot() {
        return new SnapshotBuilder();
    }

    private static final class SnapshotBuilder {
        private String ticker = "ABC";
        private MarketRegime regime = MarketRegime.YELLOW;
        private int score = 8;
        private PriceLines lines = PriceLines.of(10.0, 20.0);
        private Double price = 9.5;
        private LocalDate earnings = AS_OF.plusDays(50);
        private boolean held;
        private boolean override;
        private Integer daysToNextCatalyst;
        private Integer runway;
        private Double volatility;
        private Double mlUp;

        SnapshotBuilder ticker(String v)              { this.ticker = v; return this; }
        SnapshotBuilder regime(MarketRegime v)        { this.regime = v; return this; }
        SnapshotBuilder score(int v)                  { this.score = v; return this; }
        SnapshotBuilder lines(PriceLines v)           { this.lines = v; return this; }
        SnapshotBuilder price(Double v)               { this.price = v; return this; }
        SnapshotBuilder earnings(LocalDate v)         { this.earnings = v; return this; }
        SnapshotBuilder held(boolean v)               { this.held = v; return this; }
        SnapshotBuilder override(boolean v)           { this.override = v; return this; }
        SnapshotBuilder daysToNextCatalyst(Integer v) { this.daysToNextCatalyst = v; return this; }
        SnapshotBuilder runway(Integer v)             { this.runway = v; return this; }
        SnapshotBuilder volatility(Double v)          { this.volatility = v; return this; }
        SnapshotBuilder mlUp(Double v)                { this.mlUp = v; return this; }

        TickerSnapshot build() {
            return new TickerSnapshot(ticker, regime, ThesisView.ofScore(ticker, score), lines, price,
                AS_OF, earnings, held, override, false, daysToNextCatalyst, runway, volatility, mlUp);
        }
    }
}

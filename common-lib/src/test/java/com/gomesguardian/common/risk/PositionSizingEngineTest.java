package com.gomesguardian.common.risk;

import com.gomesguardian.common.exception.InputRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionSizingEngineTest {

    @Nested
    @DisplayName("size(): safety floor")
    class SafetyFloor {

        @Test
        @DisplayName("confidence ≤ 0.5 → 0 for any gain, loss and cap")
        void noEdgeBelowCoinFlip() {
            double[] confidences = {-0.3, 0.0, 0.25, 0.5};
            double[] values = {-50.0, 0.0, 5.0, 120.0};
            for (double c : confidences) {
                for (double gain : values) {
                    for (double loss : values) {
                        for (double cap : values) {
                            assertEquals(0.0, PositionSizingEngine.size(c, gain, loss, cap),
                                () -> "conf=" + c + " gain=" + gain + " loss=" + loss + " cap=" + cap);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("NaN confidence → 0")
        void nanConfidence() {
            assertEquals(0.0, PositionSizingEngine.size(Double.NaN, 50.0, 10.0, 20.0));
        }

        @Test
        @DisplayName("gain ≤ 0 → 0")
        void noGain() {
            assertEquals(0.0, PositionSizingEngine.size(0.9, 0.0, 10.0, 20.0));
            assertEquals(0.0, PositionSizingEngine.size(0.9, -5.0, 10.0, 20.0));
        }

        @Test
        @DisplayName("loss ≤ 0 → 0 (undefined downside)")
        void noLoss() {
            assertEquals(0.0, PositionSizingEngine.size(0.9, 50.0, 0.0, 20.0));
        }

        @Test
        @DisplayName("confidence > 1 → rejected")
        void confidenceOutOfRange() {
            assertThrows(InputRejectedException.class, () -> PositionSizingEngine.size(1.2, 50.0, 10.0, 20.0));
        }
    }

    @Nested
    @DisplayName("decide(): half-Kelly and tier cap")
    class HalfKelly {

        @Test
        @DisplayName("p=0.6, b=2 → raw 0.4, half-Kelly 20%")
        void uncapped() {
            PositionSizingDecision d = PositionSizingEngine.decide(0.6, 20.0, 10.0, 50.0, null, 0.05);
            assertEquals(20.0, d.positionPct(), 1e-9);
            assertEquals(20.0, d.rawKellyPct(), 1e-9);
            assertFalse(d.capped());
        }

        @Test
        @DisplayName("score 8 spread (gain 110.53%, loss 10%) → capped at 12%")
        void cappedAtTier() {
            PositionSizingDecision d = PositionSizingEngine.decide(0.8, 110.53, 10.0, 12.0, null, 0.05);
            assertEquals(12.0, d.positionPct(), 1e-9);
            assertTrue(d.capped());
            assertTrue(d.rawKellyPct() > 12.0);
        }

        @Test
        @DisplayName("tier cap 0 → 0 regardless of edge")
        void zeroCap() {
            assertEquals(0.0, PositionSizingEngine.size(0.95, 200.0, 5.0, 0.0));
        }

        @Test
        @DisplayName("negative Kelly (poor payoff) → 0, never negative")
        void negativeKelly() {
            // b = 0.1: f = (0.1·0.6 − 0.4)/0.1 < 0
            assertEquals(0.0, PositionSizingEngine.size(0.6, 1.0, 10.0, 20.0));
        }

        @Test
        @DisplayName("fromPrediction(): 10 → 13 with 10% stop at p=0.7 → 30% capped to 15%")
        void fromPrediction() {
            assertEquals(15.0, PositionSizingEngine.fromPrediction(0.7, 10.0, 13.0, 10.0, 15.0), 1e-9);
            assertEquals(0.0, PositionSizingEngine.fromPrediction(0.7, 10.0, 9.0, 10.0, 15.0));
        }
    }

    @Nested
    @DisplayName("volatility pass")
    class Volatility {

        @Test
        @DisplayName("volatility at or under threshold → factor 1")
        void belowThreshold() {
            assertEquals(1.0, PositionSizingEngine.volatilityFactor(null, 0.05));
            assertEquals(1.0, PositionSizingEngine.volatilityFactor(0.03, 0.05));
            assertEquals(1.0, PositionSizingEngine.volatilityFactor(0.05, 0.05));
        }

        @Test
        @DisplayName("volatility 0.15 vs 0.05 → factor e^-1")
        void decay() {
            assertEquals(Math.exp(-1.0), PositionSizingEngine.volatilityFactor(0.15, 0.05), 1e-12);
        }

        @Test
        @DisplayName("high volatility strictly reduces, never increases, size")
        void reducesSize() {
            double calm = PositionSizingEngine.decide(0.6, 20.0, 10.0, 50.0, 0.02, 0.05).positionPct();
            double wild = PositionSizingEngine.decide(0.6, 20.0, 10.0, 50.0, 0.25, 0.05).positionPct();
            assertEquals(20.0, calm, 1e-9);
            assertTrue(wild < calm);
            assertEquals(20.0 * Math.exp(-2.0), wild, 1e-9);
        }
    }

    @Nested
    @DisplayName("TierCapTable")
    class Tiers {

        @Test
        @DisplayName("score → cap table")
        void table() {
            assertEquals(20.0, TierCapTable.capPct(10));
            assertEquals(15.0, TierCapTable.capPct(9));
            assertEquals(12.0, TierCapTable.capPct(8));
            assertEquals(10.0, TierCapTable.capPct(7));
            assertEquals(5.0, TierCapTable.capPct(6));
            assertEquals(3.0, TierCapTable.capPct(5));
            assertEquals(0.0, TierCapTable.capPct(1));
            assertEquals(0.0, TierCapTable.capPct(0));
        }

        @Test
        @DisplayName("caps never increase as score falls")
        void monotonic() {
            for (int s = 1; s <= 10; s++) {
                assertTrue(TierCapTable.capPct(s) >= TierCapTable.capPct(s - 1), "score=" + s);
            }
        }

        @Test
        @DisplayName("score 11 → rejected")
        void outOfRange() {
            assertThrows(InputRejectedException.class, () -> TierCapTable.capPct(11));
        }
    }
}

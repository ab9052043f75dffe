package com.gomesguardian.common.regime;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.MarketRegime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketAlertSystemTest {

    @Nested
    @DisplayName("entry rules")
    class EntryRules {

        @Test
        @DisplayName("RED without override → blocks new entries")
        void redBlocks() {
            assertTrue(MarketAlertSystem.blocksNewEntries(MarketRegime.RED, false));
            assertFalse(MarketAlertSystem.blocksNewEntries(MarketRegime.RED, true));
        }

        @Test
        @DisplayName("GREEN, YELLOW, ORANGE → never block")
        void othersDoNotBlock() {
            assertFalse(MarketAlertSystem.blocksNewEntries(MarketRegime.GREEN, false));
            assertFalse(MarketAlertSystem.blocksNewEntries(MarketRegime.YELLOW, false));
            assertFalse(MarketAlertSystem.blocksNewEntries(MarketRegime.ORANGE, false));
        }

        @Test
        @DisplayName("speculative positions only in GREEN")
        void speculative() {
            assertTrue(MarketAlertSystem.allowsSpeculative(MarketRegime.GREEN));
            assertFalse(MarketAlertSystem.allowsSpeculative(MarketRegime.YELLOW));
        }

        @Test
        @DisplayName("cap multipliers tighten with defensiveness")
        void multipliers() {
            assertEquals(1.0, MarketAlertSystem.capMultiplier(MarketRegime.GREEN));
            assertEquals(1.0, MarketAlertSystem.capMultiplier(MarketRegime.YELLOW));
            assertEquals(0.5, MarketAlertSystem.capMultiplier(MarketRegime.ORANGE));
            assertEquals(0.25, MarketAlertSystem.capMultiplier(MarketRegime.RED));
        }
    }

    @Test
    @DisplayName("allocation per regime sums to 100 and hedges with RWM")
    void allocation() {
        for (MarketRegime regime : MarketRegime.values()) {
            MarketAllocation a = MarketAlertSystem.allocation(regime);
            assertEquals(100, a.stocksPct() + a.cashPct() + a.hedgePct(), regime.name());
            assertEquals("RWM", a.hedgeTicker());
        }
        assertEquals(100, MarketAlertSystem.allocation(MarketRegime.GREEN).stocksPct());
        assertEquals(50, MarketAlertSystem.allocation(MarketRegime.RED).hedgePct());
    }

    @Nested
    @DisplayName("transition()")
    class Transition {

        @Test
        @DisplayName("YELLOW → RED is an escalation")
        void escalation() {
            RegimeTransition t = MarketAlertSystem.transition(MarketRegime.YELLOW, MarketRegime.RED, "credit spreads");
            assertTrue(t.escalation());
            assertEquals(MarketRegime.RED, t.to());
            assertEquals("credit spreads", t.note());
        }

        @Test
        @DisplayName("ORANGE → GREEN is not an escalation")
        void deescalation() {
            assertFalse(MarketAlertSystem.transition(MarketRegime.ORANGE, MarketRegime.GREEN, null).escalation());
        }

        @Test
        @DisplayName("no previous regime → not an escalation")
        void fromNothing() {
            assertFalse(MarketAlertSystem.transition(null, MarketRegime.RED, null).escalation());
        }

        @Test
        @DisplayName("missing target regime → rejected")
        void missingTarget() {
            assertThrows(InputRejectedException.class,
                () -> MarketAlertSystem.transition(MarketRegime.GREEN, null, "x"));
        }
    }

    @Test
    @DisplayName("unknown regime → YELLOW")
    void defaultRegime() {
        assertEquals(MarketRegime.YELLOW, MarketAlertSystem.orDefault(null));
        assertEquals(MarketRegime.RED, MarketAlertSystem.orDefault(MarketRegime.RED));
    }
}

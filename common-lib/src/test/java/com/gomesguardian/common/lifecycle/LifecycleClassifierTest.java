package com.gomesguardian.common.lifecycle;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.LifecyclePhase;
import com.gomesguardian.common.model.ZoneSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleClassifierTest {

    @Nested
    @DisplayName("classify()")
    class Classify {

        @Test
        @DisplayName("runway < 6 months → DECLINE even at score 10")
        void solvencyWins() {
            assertEquals(LifecyclePhase.DECLINE, LifecycleClassifier.classify(10, true, 10, 3));
        }

        @Test
        @DisplayName("runway exactly 6 months → not a solvency risk")
        void runwayBoundary() {
            assertFalse(LifecycleClassifier.isSolvencyRisk(6));
            assertTrue(LifecycleClassifier.isSolvencyRisk(5));
            assertFalse(LifecycleClassifier.isSolvencyRisk(null));
        }

        @Test
        @DisplayName("high conviction + recent catalyst → ACTIVE_GOLD_MINE")
        void goldMine() {
            assertEquals(LifecyclePhase.ACTIVE_GOLD_MINE, LifecycleClassifier.classify(9, true, null, null));
        }

        @Test
        @DisplayName("high conviction + catalyst within 90 days → GREAT_FIND")
        void greatFind() {
            assertEquals(LifecyclePhase.GREAT_FIND, LifecycleClassifier.classify(8, false, 30, 24));
            assertEquals(LifecyclePhase.GREAT_FIND, LifecycleClassifier.classify(8, false, 90, null));
        }

        @Test
        @DisplayName("high conviction, catalyst far out or unknown → WAIT_TIME")
        void waitTime() {
            assertEquals(LifecyclePhase.WAIT_TIME, LifecycleClassifier.classify(8, false, 120, null));
            assertEquals(LifecyclePhase.WAIT_TIME, LifecycleClassifier.classify(8, false, null, null));
        }

        @Test
        @DisplayName("mid conviction → WAIT_TIME, low conviction → DECLINE")
        void byScore() {
            assertEquals(LifecyclePhase.WAIT_TIME, LifecycleClassifier.classify(5, true, 10, null));
            assertEquals(LifecyclePhase.DECLINE, LifecycleClassifier.classify(4, true, 10, null));
        }

        @Test
        @DisplayName("score outside 1..10 → rejected")
        void invalidScore() {
            assertThrows(InputRejectedException.class, () -> LifecycleClassifier.classify(0, false, null, null));
            assertThrows(InputRejectedException.class, () -> LifecycleClassifier.classify(11, false, null, null));
        }
    }

    @Nested
    @DisplayName("refineForZone()")
    class Refine {

        @Test
        @DisplayName("held ticker in a sell zone → HARVEST")
        void harvest() {
            assertEquals(LifecyclePhase.HARVEST,
                LifecycleClassifier.refineForZone(LifecyclePhase.ACTIVE_GOLD_MINE, ZoneSignal.SELL, true));
            assertEquals(LifecyclePhase.HARVEST,
                LifecycleClassifier.refineForZone(LifecyclePhase.WAIT_TIME, ZoneSignal.STRONG_SELL, true));
        }

        @Test
        @DisplayName("not held, buy zone, or DECLINE → unchanged")
        void unchanged() {
            assertEquals(LifecyclePhase.GREAT_FIND,
                LifecycleClassifier.refineForZone(LifecyclePhase.GREAT_FIND, ZoneSignal.SELL, false));
            assertEquals(LifecyclePhase.GREAT_FIND,
                LifecycleClassifier.refineForZone(LifecyclePhase.GREAT_FIND, ZoneSignal.BUY, true));
            assertEquals(LifecyclePhase.DECLINE,
                LifecycleClassifier.refineForZone(LifecyclePhase.DECLINE, ZoneSignal.STRONG_SELL, true));
            assertEquals(LifecyclePhase.WAIT_TIME,
                LifecycleClassifier.refineForZone(LifecyclePhase.WAIT_TIME, null, true));
        }
    }
}

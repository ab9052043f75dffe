package com.gomesguardian.common.drift;

import com.gomesguardian.common.exception.InputRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThesisDriftClassifierTest {

    @Nested
    @DisplayName("deterioration")
    class Deterioration {

        @Test
        @DisplayName("8 → 5 (−3) → THESIS_BROKEN, CRITICAL, needs review")
        void broken() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", 8, 5, false);
            assertEquals(DriftLevel.THESIS_BROKEN, r.driftLevel());
            assertEquals(AlertSeverity.CRITICAL, r.severity());
            assertEquals(-3, r.scoreDelta());
            assertTrue(r.needsReview());
            assertTrue(r.recommendation().startsWith("SELL IMMEDIATELY"));
        }

        @Test
        @DisplayName("6 → 4 (−2) → THESIS_DRIFT, review position")
        void driftBelowFive() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", 6, 4, true);
            assertEquals(DriftLevel.THESIS_DRIFT, r.driftLevel());
            assertEquals(AlertSeverity.WARNING, r.severity());
            assertTrue(r.recommendation().startsWith("REVIEW POSITION"));
            assertFalse(r.needsReview());
        }

        @Test
        @DisplayName("7 → 6 (−1) → THESIS_DRIFT, re-validate thesis")
        void driftAboveFive() {
            assertTrue(ThesisDriftClassifier.classify("ABC", 7, 6, false).recommendation().startsWith("RE-VALIDATE"));
        }
    }

    @Nested
    @DisplayName("stable and improvement")
    class Improvement {

        @Test
        @DisplayName("no change → STABLE, no alert")
        void stable() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", 7, 7, true);
            assertEquals(DriftLevel.STABLE, r.driftLevel());
            assertNull(r.severity());
            assertFalse(r.requiresAlert());
        }

        @Test
        @DisplayName("first analysis → STABLE with delta 0")
        void firstAnalysis() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", null, 6, false);
            assertEquals(DriftLevel.STABLE, r.driftLevel());
            assertEquals(0, r.scoreDelta());
            assertEquals("Initial analysis complete", r.message());
        }

        @Test
        @DisplayName("+1 priced at or below green → OPPORTUNITY")
        void improvementInBuyZone() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", 6, 7, true);
            assertEquals(DriftLevel.IMPROVEMENT, r.driftLevel());
            assertEquals(AlertSeverity.OPPORTUNITY, r.severity());
            assertTrue(r.recommendation().startsWith("CONSIDER ADDING"));
        }

        @Test
        @DisplayName("+2 above green → INFO")
        void improvementOutsideBuyZone() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", 6, 8, false);
            assertEquals(AlertSeverity.INFO, r.severity());
            assertTrue(r.requiresAlert());
        }

        @Test
        @DisplayName("+3 → MAJOR_IMPROVEMENT, OPPORTUNITY regardless of price")
        void majorImprovement() {
            ThesisDriftResult r = ThesisDriftClassifier.classify("ABC", 5, 8, false);
            assertEquals(DriftLevel.MAJOR_IMPROVEMENT, r.driftLevel());
            assertEquals(AlertSeverity.OPPORTUNITY, r.severity());
            assertEquals("MAJOR UPGRADE! Strong buy candidate.", r.recommendation());
        }
    }

    @Test
    @DisplayName("score outside 1..10 → rejected")
    void invalidScores() {
        assertThrows(InputRejectedException.class, () -> ThesisDriftClassifier.classify("ABC", 5, 11, false));
        assertThrows(InputRejectedException.class, () -> ThesisDriftClassifier.classify("ABC", 0, 5, false));
    }

    @Test
    @DisplayName("ThesisStatus.fromDelta() mirrors the drift bands")
    void status() {
        assertEquals(ThesisStatus.CREATED, ThesisStatus.fromDelta(null, 5));
        assertEquals(ThesisStatus.BROKEN, ThesisStatus.fromDelta(8, 5));
        assertEquals(ThesisStatus.DETERIORATING, ThesisStatus.fromDelta(7, 6));
        assertEquals(ThesisStatus.INTACT, ThesisStatus.fromDelta(7, 7));
        assertEquals(ThesisStatus.IMPROVING, ThesisStatus.fromDelta(6, 7));
    }
}

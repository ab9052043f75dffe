package com.gomesguardian.common.synthesis;

import com.gomesguardian.common.model.ConvictionScore;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Score recalculation and field merging for knowledge synthesis.
 *
 * <pre>
 *   newScore = clamp(oldScore + adjustment [+ bonus], 1, 10)
 *   forced   = clamp(forcedScore, 1, 10)
 * </pre>
 */
public final class ScoreMerger {

    private ScoreMerger() {}

    public static ScoreCalculation merge(int oldScore, ConflictAnalysis analysis, PriceContext priceContext,
                                         Integer forcedScore, SynthesisPolicy policy) {
        if (forcedScore != null) {
            return new ScoreCalculation(ConvictionScore.clamp(forcedScore), 0, 0, true);
        }
        int adjustment = analysis != null ? analysis.scoreAdjustment() : 0;
        int bonus = priceContext != null && priceContext.qualifiesForBonus() ? policy.priceContextBonus() : 0;
        int newScore = ConvictionScore.clamp(oldScore + adjustment + bonus);
        return new ScoreCalculation(newScore, adjustment, bonus, false);
    }

    public static MergeAction actionFor(int oldScore, int newScore, ConflictAnalysis analysis) {
        if (analysis != null && analysis.hasConflicts()) {
            return MergeAction.CONFLICT;
        }
        if (oldScore != newScore || (analysis != null && !analysis.positiveDevelopments().isEmpty())) {
            return MergeAction.UPDATED;
        }
        return MergeAction.NO_CHANGE;
    }

    /**
     * Appends the lines of {@code addition} that {@code existing} does not already
     * contain. Never removes anything.
     *
     * @return the merged text, or {@code existing} when nothing new was supplied
     */
    public static String appendDistinct(String existing, String addition) {
        if (addition == null || addition.isBlank()) {
            return existing;
        }
        Set<String> present = existing == null ? Set.of() : Arrays.stream(existing.split("\n"))
            .map(String::trim)
            .collect(Collectors.toSet());
        Set<String> fresh = new LinkedHashSet<>();
        for (String line : addition.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !present.contains(trimmed)) {
                fresh.add(trimmed);
            }
        }
        if (fresh.isEmpty()) {
            return existing;
        }
        String joined = String.join("\n", fresh);
        return existing == null || existing.isBlank() ? joined : existing + "\n" + joined;
    }
}

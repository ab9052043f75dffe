package com.gomesguardian.common.synthesis;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.ConvictionScore;

/**
 * Tunable constants of knowledge synthesis.
 *
 * @param aiTimeoutMs           upper bound on one AI classification call
 * @param maxMergeRetries       retries after a lost per-ticker race
 * @param priceContextBonus     points added for bullish language at/below the green line
 * @param newThesisScore        score of a thesis created by its first merge
 * @param minAiAdjustment       lower bound applied to AI score adjustments
 * @param maxAiAdjustment       upper bound applied to AI score adjustments
 * @param maxClassifiedChars    new text is truncated to this length before AI classification
 * @param narrativeExcerptChars new text is truncated to this length in the narrative log
 */
public record SynthesisPolicy(
    long aiTimeoutMs,
    int  maxMergeRetries,
    int  priceContextBonus,
    int  newThesisScore,
    int  minAiAdjustment,
    int  maxAiAdjustment,
    int  maxClassifiedChars,
    int  narrativeExcerptChars
) {
    public SynthesisPolicy {
        if (aiTimeoutMs <= 0) {
            throw new InputRejectedException("SynthesisPolicy", "AI timeout must be positive");
        }
        if (maxMergeRetries < 0) {
            throw new InputRejectedException("SynthesisPolicy", "merge retries must be >= 0");
        }
        if (minAiAdjustment > maxAiAdjustment) {
            throw new InputRejectedException("SynthesisPolicy", "AI adjustment bounds are inverted");
        }
        ConvictionScore.require(newThesisScore, "SynthesisPolicy");
    }

    public static SynthesisPolicy defaults() {
        return new SynthesisPolicy(4000L, 3, 1, 5, -4, 2, 5000, 500);
    }

    public int clampAiAdjustment(int adjustment) {
        return Math.max(minAiAdjustment, Math.min(maxAiAdjustment, adjustment));
    }
}

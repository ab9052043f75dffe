package com.gomesguardian.common.model;

import com.gomesguardian.common.exception.InputRejectedException;

/**
 * Bounds of the 1..10 conviction score.
 */
public final class ConvictionScore {

    public static final int MIN = 1;
    public static final int MAX = 10;

    private ConvictionScore() {}

    /** Clamps any integer into [{@value #MIN}, {@value #MAX}]. */
    public static int clamp(int score) {
        return Math.max(MIN, Math.min(MAX, score));
    }

    /** Returns {@code score} unchanged, or rejects it when it lies outside the range. */
    public static int require(int score, String component) {
        if (score < MIN || score > MAX) {
            throw new InputRejectedException(component,
                "conviction score must be in [" + MIN + "," + MAX + "], got " + score);
        }
        return score;
    }
}

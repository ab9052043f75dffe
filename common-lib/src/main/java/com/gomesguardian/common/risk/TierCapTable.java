package com.gomesguardian.common.risk;

import com.gomesguardian.common.exception.InputRejectedException;

/**
 * Maximum portfolio percentage permitted for a conviction score.
 *
 * <pre>
 *   score  10   9   8   7   6   5   4   3   2    ≤1
 *   cap %  20  15  12  10   5   3   2   1  0.5   0
 * </pre>
 *
 * The cap is a hard ceiling on every sizing result.
 */
public final class TierCapTable {

    private static final double[] CAP_BY_SCORE = {
        0.0,   // 0
        0.0,   // 1
        0.5,   // 2
        1.0,   // 3
        2.0,   // 4
        3.0,   // 5
        5.0,   // 6
        10.0,  // 7
        12.0,  // 8
        15.0,  // 9
        20.0   // 10
    };

    private TierCapTable() {}

    public static double capPct(int score) {
        if (score < 0 || score > 10) {
            throw new InputRejectedException("TierCapTable", "score must be in [0,10], got " + score);
        }
        return CAP_BY_SCORE[score];
    }
}

package com.gomesguardian.common.synthesis;

/**
 * How a merged score was derived.
 *
 * @param newScore   resulting score, always in [1,10]
 * @param adjustment conflict-analysis adjustment that was applied
 * @param bonus      price-context bonus that was applied
 * @param forced     true when a forced score replaced the computation
 */
public record ScoreCalculation(int newScore, int adjustment, int bonus, boolean forced) {}

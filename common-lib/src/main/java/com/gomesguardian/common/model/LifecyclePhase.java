package com.gomesguardian.common.model;

/**
 * Stage of an investment idea.
 *
 * <pre>
 *   GREAT_FIND        high conviction, catalyst within reach
 *   ACTIVE_GOLD_MINE  high conviction, catalyst recently confirmed
 *   WAIT_TIME         no near catalyst or moderate conviction (dead money)
 *   HARVEST           held position priced into its sell zone
 *   DECLINE           weak conviction or solvency risk
 * </pre>
 */
public enum LifecyclePhase {
    GREAT_FIND,
    ACTIVE_GOLD_MINE,
    WAIT_TIME,
    HARVEST,
    DECLINE
}

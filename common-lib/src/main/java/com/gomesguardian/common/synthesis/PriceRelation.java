package com.gomesguardian.common.synthesis;

/** Where a price mentioned in new information sits relative to the green line. */
public enum PriceRelation {
    BELOW_GREEN,
    AT_GREEN,
    ABOVE_GREEN,
    UNKNOWN
}

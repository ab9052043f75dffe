package com.gomesguardian.common.drift;

/** Thesis health recorded with each score history entry. */
public enum ThesisStatus {
    CREATED,
    INTACT,
    IMPROVING,
    DETERIORATING,
    BROKEN;

    public static ThesisStatus fromDelta(Integer previousScore, int newScore) {
        if (previousScore == null) return CREATED;
        int delta = newScore - previousScore;
        if (delta <= ThesisDriftClassifier.BROKEN_DELTA) return BROKEN;
        if (delta < 0)                                   return DETERIORATING;
        if (delta > 0)                                   return IMPROVING;
        return INTACT;
    }
}

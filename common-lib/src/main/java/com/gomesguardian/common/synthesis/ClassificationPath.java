package com.gomesguardian.common.synthesis;

/** Which conflict-detection path produced a {@link ConflictAnalysis}. */
public enum ClassificationPath {
    AI,
    FALLBACK
}

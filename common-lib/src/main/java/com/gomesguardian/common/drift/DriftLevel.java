package com.gomesguardian.common.drift;

/** Classification of a score delta between two successive analyses. */
public enum DriftLevel {
    THESIS_BROKEN,
    THESIS_DRIFT,
    STABLE,
    IMPROVEMENT,
    MAJOR_IMPROVEMENT
}

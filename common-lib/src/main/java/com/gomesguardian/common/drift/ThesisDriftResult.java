package com.gomesguardian.common.drift;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Classification of one score change.
 *
 * @param severity       null for STABLE
 * @param needsReview    the ticker must be flagged for manual review
 * @param alertCreated   set by the persisting caller once an alert row exists
 */
public record ThesisDriftResult(
    @JsonProperty("ticker")         String ticker,
    @JsonProperty("previousScore")  Integer previousScore,
    @JsonProperty("currentScore")   int currentScore,
    @JsonProperty("scoreDelta")     int scoreDelta,
    @JsonProperty("driftLevel")     DriftLevel driftLevel,
    @JsonProperty("severity")       AlertSeverity severity,
    @JsonProperty("title")          String title,
    @JsonProperty("message")        String message,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("needsReview")    boolean needsReview,
    @JsonProperty("alertCreated")   boolean alertCreated
) {
    /** STABLE never produces an alert row. */
    public boolean requiresAlert() {
        return driftLevel != DriftLevel.STABLE;
    }

    public ThesisDriftResult withAlertCreated(boolean created) {
        return new ThesisDriftResult(ticker, previousScore, currentScore, scoreDelta, driftLevel, severity,
            title, message, recommendation, needsReview, created);
    }
}

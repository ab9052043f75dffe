package com.gomesguardian.thesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * New information for one ticker. Fact fields are optional additions merged line by
 * line into the stored thesis; {@code forcedScore} bypasses the score computation.
 */
public record MergeRequest(
    @JsonProperty("text")          String text,
    @JsonProperty("source")        String source,
    @JsonProperty("forcedScore")   Integer forcedScore,
    @JsonProperty("edge")          String edge,
    @JsonProperty("catalysts")     String catalysts,
    @JsonProperty("risks")         String risks,
    @JsonProperty("actionVerdict") String actionVerdict
) {
    public static MergeRequest of(String text, String source) {
        return new MergeRequest(text, source, null, null, null, null, null);
    }
}

package com.gomesguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Read-only view of a ticker's investment thesis, as handed to the gatekeeper.
 */
public record ThesisView(
    @JsonProperty("ticker")          String ticker,
    @JsonProperty("convictionScore") int convictionScore,
    @JsonProperty("edge")            String edge,
    @JsonProperty("catalysts")       String catalysts,
    @JsonProperty("risks")           String risks,
    @JsonProperty("actionVerdict")   String actionVerdict,
    @JsonProperty("lastUpdated")     LocalDateTime lastUpdated
) {
    public static ThesisView ofScore(String ticker, int convictionScore) {
        return new ThesisView(ticker, convictionScore, null, null, null, null, null);
    }
}

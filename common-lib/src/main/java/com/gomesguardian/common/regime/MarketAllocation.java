package com.gomesguardian.common.regime;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Target portfolio split for a market regime, in percent.
 */
public record MarketAllocation(
    @JsonProperty("stocksPct")   int stocksPct,
    @JsonProperty("cashPct")     int cashPct,
    @JsonProperty("hedgePct")    int hedgePct,
    @JsonProperty("hedgeTicker") String hedgeTicker
) {}

package com.gomesguardian.common.regime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gomesguardian.common.model.MarketRegime;

/**
 * One operator-issued regime change. {@code from} is null for the first ever setting.
 */
public record RegimeTransition(
    @JsonProperty("from")       MarketRegime from,
    @JsonProperty("to")         MarketRegime to,
    @JsonProperty("note")       String note,
    @JsonProperty("escalation") boolean escalation
) {}

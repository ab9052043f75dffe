package com.gomesguardian.thesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gomesguardian.common.model.MarketRegime;

public record MarketRegimeRequest(
    @JsonProperty("regime")    MarketRegime regime,
    @JsonProperty("note")      String note,
    @JsonProperty("changedBy") String changedBy
) {}

package com.gomesguardian.thesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DriftRequest(
    @JsonProperty("previousScore") Integer previousScore,
    @JsonProperty("newScore")      Integer newScore,
    @JsonProperty("source")        String source,
    @JsonProperty("currentPrice")  Double currentPrice
) {}

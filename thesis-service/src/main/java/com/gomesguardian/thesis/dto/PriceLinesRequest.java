package com.gomesguardian.thesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriceLinesRequest(
    @JsonProperty("greenLine") Double greenLine,
    @JsonProperty("redLine")   Double redLine,
    @JsonProperty("greyLine")  Double greyLine,
    @JsonProperty("source")    String source
) {}

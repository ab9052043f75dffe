package com.gomesguardian.thesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Caller-supplied market facts for an evaluation against stored thesis, regime and
 * price lines.
 */
public record StoredEvaluationRequest(
    @JsonProperty("currentPrice")       Double currentPrice,
    @JsonProperty("earningsDate")       LocalDate earningsDate,
    @JsonProperty("held")               boolean held,
    @JsonProperty("regimeOverride")     boolean regimeOverride,
    @JsonProperty("hasRecentCatalyst")  boolean hasRecentCatalyst,
    @JsonProperty("daysToNextCatalyst") Integer daysToNextCatalyst,
    @JsonProperty("cashRunwayMonths")   Integer cashRunwayMonths,
    @JsonProperty("trailingVolatility") Double trailingVolatility,
    @JsonProperty("mlUpConfidence")     Double mlUpConfidence
) {}

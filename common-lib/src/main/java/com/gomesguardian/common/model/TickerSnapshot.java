package com.gomesguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Everything the gatekeeper needs to evaluate one ticker. Callers assemble it
 * from stored state; evaluation itself performs no I/O.
 *
 * @param asOf                 evaluation date ("today")
 * @param earningsDate         next earnings date; null when unknown
 * @param held                 true when the portfolio currently holds the ticker
 * @param regimeOverride       explicit operator override allowing entries under RED
 * @param hasRecentCatalyst    a catalyst has recently been confirmed
 * @param daysToNextCatalyst   days until the next expected catalyst; null when none known
 * @param cashRunwayMonths     months of cash at current burn; null when unknown
 * @param trailingVolatility   trailing daily volatility as a fraction; null to skip the volatility pass
 * @param mlUpConfidence       confidence of an upward model prediction in [0,1]; null when none
 */
public record TickerSnapshot(
    @JsonProperty("ticker")             String ticker,
    @JsonProperty("regime")             MarketRegime regime,
    @JsonProperty("thesis")             ThesisView thesis,
    @JsonProperty("priceLines")         PriceLines priceLines,
    @JsonProperty("currentPrice")       Double currentPrice,
    @JsonProperty("asOf")               LocalDate asOf,
    @JsonProperty("earningsDate")       LocalDate earningsDate,
    @JsonProperty("held")               boolean held,
    @JsonProperty("regimeOverride")     boolean regimeOverride,
    @JsonProperty("hasRecentCatalyst")  boolean hasRecentCatalyst,
    @JsonProperty("daysToNextCatalyst") Integer daysToNextCatalyst,
    @JsonProperty("cashRunwayMonths")   Integer cashRunwayMonths,
    @JsonProperty("trailingVolatility") Double trailingVolatility,
    @JsonProperty("mlUpConfidence")     Double mlUpConfidence
) {}

package com.gomesguardian.thesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gomesguardian.common.model.MarketRegime;
import com.gomesguardian.common.regime.MarketAllocation;

import java.time.LocalDateTime;

/**
 * Current market regime with its mode and target allocation. {@code updatedAt} is
 * null when the regime was never set and the default applies.
 */
public record MarketRegimeDTO(
    @JsonProperty("regime")      MarketRegime regime,
    @JsonProperty("mode")        String mode,
    @JsonProperty("description") String description,
    @JsonProperty("allocation")  MarketAllocation allocation,
    @JsonProperty("note")        String note,
    @JsonProperty("version")     Long version,
    @JsonProperty("updatedBy")   String updatedBy,
    @JsonProperty("updatedAt")   LocalDateTime updatedAt
) {}

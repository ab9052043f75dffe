package com.gomesguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Gatekeeper output for one ticker. {@code maxPositionPct} is a percent of
 * portfolio and is always 0 unless {@code decision == ALLOW}.
 *
 * @param blockedReason name of the compliance rule when {@code decision == BLOCKED}
 * @param tierCapPct    score tier cap after regime dampening
 * @param kellyPct      half-Kelly size before capping
 * @param explanation   human-readable trace of the rules that fired
 */
public record Verdict(
    @JsonProperty("ticker")         String ticker,
    @JsonProperty("decision")       VerdictDecision decision,
    @JsonProperty("gomesScore")     int gomesScore,
    @JsonProperty("maxPositionPct") double maxPositionPct,
    @JsonProperty("lifecyclePhase") LifecyclePhase lifecyclePhase,
    @JsonProperty("zoneSignal")     ZoneSignal zoneSignal,
    @JsonProperty("regime")         MarketRegime regime,
    @JsonProperty("riskFactors")    List<String> riskFactors,
    @JsonProperty("blockedReason")  String blockedReason,
    @JsonProperty("tierCapPct")     double tierCapPct,
    @JsonProperty("kellyPct")       double kellyPct,
    @JsonProperty("evaluatedOn")    LocalDate evaluatedOn,
    @JsonProperty("explanation")    String explanation
) {
    public Verdict {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }

    public boolean isAllowed() {
        return decision == VerdictDecision.ALLOW;
    }
}

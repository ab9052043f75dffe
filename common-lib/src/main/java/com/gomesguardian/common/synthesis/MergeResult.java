package com.gomesguardian.common.synthesis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one merge. {@code oldScore} is null for a newly created thesis.
 */
public record MergeResult(
    @JsonProperty("ticker")             String ticker,
    @JsonProperty("action")             MergeAction action,
    @JsonProperty("oldScore")           Integer oldScore,
    @JsonProperty("newScore")           int newScore,
    @JsonProperty("conflicts")          List<String> conflicts,
    @JsonProperty("conflictType")       ConflictType conflictType,
    @JsonProperty("classificationPath") ClassificationPath classificationPath,
    @JsonProperty("mergedFields")       List<String> mergedFields,
    @JsonProperty("alertGenerated")     boolean alertGenerated,
    @JsonProperty("explanation")        String explanation
) {
    public MergeResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        mergedFields = mergedFields == null ? List.of() : List.copyOf(mergedFields);
    }

    public MergeResult withAlertGenerated(boolean generated) {
        return new MergeResult(ticker, action, oldScore, newScore, conflicts, conflictType,
            classificationPath, mergedFields, generated, explanation);
    }
}

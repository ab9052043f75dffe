package com.gomesguardian.common.synthesis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of conflict detection. Both detection paths produce this shape; only
 * {@code path} tells them apart.
 */
public record ConflictAnalysis(
    @JsonProperty("conflictType")         ConflictType conflictType,
    @JsonProperty("conflicts")            List<String> conflicts,
    @JsonProperty("positiveDevelopments") List<String> positiveDevelopments,
    @JsonProperty("scoreAdjustment")      int scoreAdjustment,
    @JsonProperty("explanation")          String explanation,
    @JsonProperty("path")                 ClassificationPath path
) {
    public ConflictAnalysis {
        conflictType = conflictType != null ? conflictType : ConflictType.fromAdjustment(scoreAdjustment);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        positiveDevelopments = positiveDevelopments == null ? List.of() : List.copyOf(positiveDevelopments);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}

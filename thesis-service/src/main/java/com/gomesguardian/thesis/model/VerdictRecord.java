package com.gomesguardian.thesis.model;

import com.gomesguardian.common.model.Verdict;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/** Append-only log of verdicts produced from stored state. */
@Data
@NoArgsConstructor
@Table("verdict_log")
public class VerdictRecord {

    @Id
    private Long id;

    private String ticker;
    private String decision;
    private int gomesScore;
    private double maxPositionPct;
    private String lifecyclePhase;
    private String zoneSignal;
    private String regime;
    private String riskFactors;
    private String blockedReason;
    private String explanation;
    private LocalDate evaluatedOn;
    private LocalDateTime createdAt;

    public static VerdictRecord from(Verdict verdict, LocalDateTime createdAt) {
        VerdictRecord r = new VerdictRecord();
        r.setTicker(verdict.ticker());
        r.setDecision(verdict.decision().name());
        r.setGomesScore(verdict.gomesScore());
        r.setMaxPositionPct(verdict.maxPositionPct());
        r.setLifecyclePhase(verdict.lifecyclePhase() != null ? verdict.lifecyclePhase().name() : null);
        r.setZoneSignal(verdict.zoneSignal() != null ? verdict.zoneSignal().name() : null);
        r.setRegime(verdict.regime().name());
        r.setRiskFactors(String.join(",", verdict.riskFactors()));
        r.setBlockedReason(verdict.blockedReason());
        r.setExplanation(verdict.explanation());
        r.setEvaluatedOn(verdict.evaluatedOn());
        r.setCreatedAt(createdAt);
        return r;
    }
}

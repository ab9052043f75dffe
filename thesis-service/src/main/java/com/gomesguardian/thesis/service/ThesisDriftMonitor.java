package com.gomesguardian.thesis.service;

import com.gomesguardian.common.drift.AlertSeverity;
import com.gomesguardian.common.drift.ThesisDriftClassifier;
import com.gomesguardian.common.drift.ThesisDriftResult;
import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.gatekeeper.GomesGatekeeper;
import com.gomesguardian.common.synthesis.ConflictAnalysis;
import com.gomesguardian.common.synthesis.ConflictType;
import com.gomesguardian.common.zone.TradingZoneEngine;
import com.gomesguardian.thesis.model.DriftAlert;
import com.gomesguardian.thesis.model.ThesisRecord;
import com.gomesguardian.thesis.repository.DriftAlertRepository;
import com.gomesguardian.thesis.repository.ThesisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Turns score changes into drift alerts.
 *
 * <p>Classification is delegated to {@link ThesisDriftClassifier}; this service
 * persists the alert (never for STABLE) and flags broken theses for review.
 * {@link #createAlert} is the single place alert rows are written, and is shared
 * with the conflict alerts raised by knowledge synthesis.
 */
@Service
public class ThesisDriftMonitor {

    private static final Logger log = LoggerFactory.getLogger(ThesisDriftMonitor.class);

    static final String REVIEW_REASON_BROKEN = "THESIS_BROKEN";
    static final String CONFLICT_ALERT_PREFIX = "CONFLICT_";

    private final DriftAlertRepository alertRepository;
    private final ThesisRepository thesisRepository;
    private final PriceLinesService priceLinesService;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    public ThesisDriftMonitor(DriftAlertRepository alertRepository,
                              ThesisRepository thesisRepository,
                              PriceLinesService priceLinesService,
                              TransactionalOperator transactionalOperator,
                              Clock clock) {
        this.alertRepository = alertRepository;
        this.thesisRepository = thesisRepository;
        this.priceLinesService = priceLinesService;
        this.transactionalOperator = transactionalOperator;
        this.clock = clock;
    }

    /**
     * Classifies a score change and records its alert.
     *
     * @param previousScore null for a first analysis (treated as STABLE)
     * @param currentPrice  used to tell OPPORTUNITY from INFO improvements; may be null
     */
    public Mono<ThesisDriftResult> analyzeDrift(String ticker, Integer previousScore, int newScore,
                                                String source, Double currentPrice) {
        if (ticker == null || ticker.isBlank()) {
            return Mono.error(new InputRejectedException("DriftMonitor", "ticker is required"));
        }
        String t = GomesGatekeeper.normalizeTicker(ticker);

        return priceLinesService.currentLines(t)
            .map(lines -> TradingZoneEngine.isAtOrBelowGreen(currentPrice, lines.greenLine()))
            .defaultIfEmpty(false)
            .map(atOrBelowGreen -> ThesisDriftClassifier.classify(t, previousScore, newScore, atOrBelowGreen))
            .flatMap(result -> record(result, source))
            .doOnSuccess(r -> log.info("[DriftMonitor] Drift analysed. ticker={} delta={} level={} severity={} alert={}",
                                       t, r.scoreDelta(), r.driftLevel(), r.severity(), r.alertCreated()));
    }

    /**
     * Raises the alert for a SIGNIFICANT or CRITICAL merge conflict. Runs inside the
     * caller's transaction.
     */
    public Mono<DriftAlert> raiseConflictAlert(String ticker, int oldScore, int newScore,
                                               ConflictAnalysis analysis, String source) {
        AlertSeverity severity = analysis.conflictType() == ConflictType.CRITICAL
            ? AlertSeverity.CRITICAL
            : AlertSeverity.WARNING;
        String message = analysis.conflicts().isEmpty()
            ? analysis.explanation()
            : "Conflicts: " + String.join("; ", analysis.conflicts()) + ". " + analysis.explanation();
        return createAlert(ticker, CONFLICT_ALERT_PREFIX + analysis.conflictType().name(), severity,
            oldScore, newScore, analysis.conflictType() + " conflict: " + ticker, message,
            severity == AlertSeverity.CRITICAL
                ? "REVIEW IMMEDIATELY. New information contradicts the thesis."
                : "RE-VALIDATE THESIS against the new information.",
            source);
    }

    /** Acknowledges an alert; empty when the id is unknown. Repeating is harmless. */
    public Mono<DriftAlert> acknowledge(Long alertId) {
        return alertRepository.acknowledge(alertId, LocalDateTime.now(clock))
            .then(alertRepository.findById(alertId))
            .doOnSuccess(a -> {
                if (a != null) {
                    log.info("[DriftMonitor] Alert acknowledged. id={} ticker={} type={}",
                             a.getId(), a.getTicker(), a.getAlertType());
                }
            });
    }

    /**
     * @param severity optional filter; null returns every severity ordered by priority
     */
    public Flux<DriftAlert> pendingAlerts(AlertSeverity severity, int limit) {
        if (limit < 1) {
            return Flux.error(new InputRejectedException("DriftMonitor", "limit must be at least 1, got " + limit));
        }
        return severity == null
            ? alertRepository.findPending(limit)
            : alertRepository.findPendingBySeverity(severity.name(), limit);
    }

    public Flux<DriftAlert> alertsFor(String ticker) {
        return alertRepository.findByTickerOrderByCreatedAtDesc(GomesGatekeeper.normalizeTicker(ticker));
    }

    public Flux<ThesisRecord> needingReview() {
        return thesisRepository.findNeedingReview();
    }

    // ── persistence ───────────────────────────────────────────────────────────

    private Mono<ThesisDriftResult> record(ThesisDriftResult result, String source) {
        if (!result.requiresAlert()) {
            return Mono.just(result);
        }
        Mono<ThesisDriftResult> write = createAlert(result.ticker(), result.driftLevel().name(), result.severity(),
                result.previousScore(), result.currentScore(), result.title(), result.message(),
                result.recommendation(), source)
            .flatMap(alert -> result.needsReview()
                ? thesisRepository.markNeedsReview(result.ticker(), REVIEW_REASON_BROKEN)
                    .doOnNext(n -> log.warn("[DriftMonitor] Thesis flagged for review. ticker={} reason={}",
                                            result.ticker(), REVIEW_REASON_BROKEN))
                    .thenReturn(alert)
                : Mono.just(alert))
            .map(alert -> result.withAlertCreated(true));
        return transactionalOperator.transactional(write);
    }

    Mono<DriftAlert> createAlert(String ticker, String alertType, AlertSeverity severity,
                                 Integer oldScore, int newScore, String title, String message,
                                 String recommendation, String source) {
        return Mono.defer(() -> {
            DriftAlert alert = new DriftAlert();
            alert.setTicker(ticker);
            alert.setAlertType(alertType);
            alert.setSeverity(severity.name());
            alert.setOldScore(oldScore);
            alert.setNewScore(newScore);
            alert.setTitle(title);
            alert.setMessage(message);
            alert.setRecommendation(recommendation);
            alert.setSource(source);
            alert.setAcknowledged(false);
            alert.setCreatedAt(LocalDateTime.now(clock));
            return alertRepository.save(alert);
        })
        .doOnSuccess(a -> log.info("[DriftMonitor] Alert created. ticker={} type={} severity={} oldScore={} newScore={}",
                                   ticker, alertType, severity, oldScore, newScore));
    }
}

package com.gomesguardian.thesis.service;

import com.gomesguardian.common.drift.ThesisStatus;
import com.gomesguardian.common.exception.CollaboratorUnavailableException;
import com.gomesguardian.common.exception.ConcurrencyConflictException;
import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.gatekeeper.GomesGatekeeper;
import com.gomesguardian.common.model.ConvictionScore;
import com.gomesguardian.common.synthesis.ClassificationPath;
import com.gomesguardian.common.synthesis.ConflictAnalysis;
import com.gomesguardian.common.synthesis.ConflictType;
import com.gomesguardian.common.synthesis.KeywordConflictDetector;
import com.gomesguardian.common.synthesis.MergeAction;
import com.gomesguardian.common.synthesis.MergeResult;
import com.gomesguardian.common.synthesis.PriceContext;
import com.gomesguardian.common.synthesis.PriceContextAnalyzer;
import com.gomesguardian.common.synthesis.ScoreCalculation;
import com.gomesguardian.common.synthesis.ScoreMerger;
import com.gomesguardian.common.synthesis.SynthesisPolicy;
import com.gomesguardian.thesis.ai.ThesisConflictClassifier;
import com.gomesguardian.thesis.dto.MergeRequest;
import com.gomesguardian.thesis.model.NarrativeEntry;
import com.gomesguardian.thesis.model.ScoreHistoryEntry;
import com.gomesguardian.thesis.model.ThesisRecord;
import com.gomesguardian.thesis.repository.NarrativeEntryRepository;
import com.gomesguardian.thesis.repository.ScoreHistoryRepository;
import com.gomesguardian.thesis.repository.ThesisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges new unstructured information into a ticker's thesis.
 *
 * <h3>Merge flow</h3>
 * <ol>
 *   <li>Read the thesis. None yet → create it at the configured starting score (CREATED).</li>
 *   <li>Classify the new text against the thesis, outside any transaction: AI classifier
 *       bounded by a timeout, keyword fallback on any failure.</li>
 *   <li>In one transaction: lock the thesis row, verify it is the version that was
 *       classified, append the narrative entry, update score and facts, append the
 *       score history entry, and raise a conflict alert for SIGNIFICANT/CRITICAL conflicts.</li>
 *   <li>A lost race ({@link ConcurrencyConflictException}) re-runs the whole flow on a
 *       freshly read thesis, up to the configured number of retries.</li>
 * </ol>
 *
 * <p>The stored thesis is never overwritten wholesale: facts are merged line by line
 * and the narrative is an append-only log.
 */
@Service
public class KnowledgeSynthesisService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeSynthesisService.class);

    private static final String COMPONENT = "KnowledgeSynthesis";
    static final String DEFAULT_SOURCE = "manual";

    // Column widths of thesis.ticker, thesis_narrative.source and thesis.action_verdict.
    static final int MAX_TICKER_LENGTH = 20;
    static final int MAX_SOURCE_LENGTH = 100;
    static final int MAX_ACTION_VERDICT_LENGTH = 40;

    private final ThesisRepository thesisRepository;
    private final NarrativeEntryRepository narrativeRepository;
    private final ScoreHistoryRepository scoreHistoryRepository;
    private final PriceLinesService priceLinesService;
    private final ThesisDriftMonitor driftMonitor;
    private final ThesisConflictClassifier conflictClassifier;
    private final TransactionalOperator transactionalOperator;
    private final SynthesisPolicy policy;
    private final Clock clock;

    public KnowledgeSynthesisService(ThesisRepository thesisRepository,
                                     NarrativeEntryRepository narrativeRepository,
                                     ScoreHistoryRepository scoreHistoryRepository,
                                     PriceLinesService priceLinesService,
                                     ThesisDriftMonitor driftMonitor,
                                     ThesisConflictClassifier conflictClassifier,
                                     TransactionalOperator transactionalOperator,
                                     SynthesisPolicy policy,
                                     Clock clock) {
        this.thesisRepository = thesisRepository;
        this.narrativeRepository = narrativeRepository;
        this.scoreHistoryRepository = scoreHistoryRepository;
        this.priceLinesService = priceLinesService;
        this.driftMonitor = driftMonitor;
        this.conflictClassifier = conflictClassifier;
        this.transactionalOperator = transactionalOperator;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Merges {@code request} into the thesis of {@code ticker}.
     *
     * @return the merge outcome; errors with {@link InputRejectedException} for a blank
     *         ticker or text or an over-long ticker, source or action verdict, and with {@link ConcurrencyConflictException} only when
     *         every retry lost the race
     */
    public Mono<MergeResult> merge(String ticker, MergeRequest request) {
        if (ticker == null || ticker.isBlank()) {
            return Mono.error(new InputRejectedException(COMPONENT, "ticker is required"));
        }
        if (request == null || request.text() == null || request.text().isBlank()) {
            return Mono.error(new InputRejectedException(COMPONENT, "new information text is required"));
        }
        String t = GomesGatekeeper.normalizeTicker(ticker);
        String source = request.source() == null || request.source().isBlank() ? DEFAULT_SOURCE : request.source().trim();
        if (t.length() > MAX_TICKER_LENGTH) {
            return Mono.error(new InputRejectedException(COMPONENT,
                "ticker longer than " + MAX_TICKER_LENGTH + " characters"));
        }
        if (source.length() > MAX_SOURCE_LENGTH) {
            return Mono.error(new InputRejectedException(COMPONENT,
                "source longer than " + MAX_SOURCE_LENGTH + " characters, ticker=" + t));
        }
        if (request.actionVerdict() != null && request.actionVerdict().trim().length() > MAX_ACTION_VERDICT_LENGTH) {
            return Mono.error(new InputRejectedException(COMPONENT,
                "action verdict longer than " + MAX_ACTION_VERDICT_LENGTH + " characters, ticker=" + t));
        }

        return Mono.defer(() -> attemptMerge(t, request, source))
            .retryWhen(Retry.max(policy.maxMergeRetries())
                .filter(ConcurrencyConflictException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("[KnowledgeSynthesis] Lost merge race, retrying with fresh thesis. ticker={} attempt={}",
                                                  t, signal.totalRetries() + 1))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .doOnSuccess(r -> log.info("[KnowledgeSynthesis] Merge complete. ticker={} action={} oldScore={} newScore={} conflictType={} path={} alert={}",
                                       t, r.action(), r.oldScore(), r.newScore(), r.conflictType(),
                                       r.classificationPath(), r.alertGenerated()))
            .doOnError(e -> log.error("[KnowledgeSynthesis] Merge failed. ticker={} source={}", t, source, e));
    }

    public Mono<ThesisRecord> thesis(String ticker) {
        return thesisRepository.findByTicker(GomesGatekeeper.normalizeTicker(ticker));
    }

    public Flux<NarrativeEntry> narrative(String ticker) {
        return narrativeRepository.findByTickerOrderBySequenceNoAsc(GomesGatekeeper.normalizeTicker(ticker));
    }

    public Flux<ScoreHistoryEntry> scoreHistory(String ticker, int limit) {
        if (limit < 1) {
            return Flux.error(new InputRejectedException(COMPONENT, "limit must be at least 1, got " + limit));
        }
        return scoreHistoryRepository.findRecent(GomesGatekeeper.normalizeTicker(ticker), limit);
    }

    // ── merge flow ────────────────────────────────────────────────────────────

    private Mono<MergeResult> attemptMerge(String ticker, MergeRequest request, String source) {
        return thesisRepository.findByTicker(ticker)
            .flatMap(existing -> updateExisting(existing, request, source))
            .switchIfEmpty(Mono.defer(() -> createThesis(ticker, request, source)));
    }

    private Mono<MergeResult> updateExisting(ThesisRecord snapshot, MergeRequest request, String source) {
        Mono<Optional<Double>> greenLine = priceLinesService.currentLines(snapshot.getTicker())
            .map(lines -> Optional.of(lines.greenLine()))
            .defaultIfEmpty(Optional.empty());

        return Mono.zip(classify(snapshot, request.text()), greenLine)
            .flatMap(tuple -> commitMerge(snapshot, request, source, tuple.getT1(), tuple.getT2().orElse(null)));
    }

    /**
     * AI classification with a bounded timeout; any failure, timeout or empty answer
     * falls back to the keyword detector.
     */
    Mono<ConflictAnalysis> classify(ThesisRecord thesis, String text) {
        String truncated = truncate(text, policy.maxClassifiedChars());
        return Mono.defer(() -> conflictClassifier.classify(summarize(thesis), truncated))
            .timeout(Duration.ofMillis(policy.aiTimeoutMs()))
            .switchIfEmpty(Mono.error(new CollaboratorUnavailableException(COMPONENT, "classifier returned no result")))
            .map(this::boundAiResult)
            .onErrorResume(e -> {
                log.warn("[KnowledgeSynthesis] AI classification unavailable, using keyword fallback (non-fatal). ticker={} reason={}",
                         thesis.getTicker(), e.getMessage());
                return Mono.just(KeywordConflictDetector.analyze(text));
            });
    }

    private Mono<MergeResult> commitMerge(ThesisRecord snapshot, MergeRequest request, String source,
                                          ConflictAnalysis analysis, Double greenLine) {
        String ticker = snapshot.getTicker();

        Mono<MergeResult> write = thesisRepository.lockByTicker(ticker)
            .switchIfEmpty(Mono.error(new ConcurrencyConflictException(COMPONENT, ticker, "thesis vanished during merge")))
            .flatMap(locked -> {
                if (!Objects.equals(locked.getVersion(), snapshot.getVersion())) {
                    return Mono.error(new ConcurrencyConflictException(COMPONENT, ticker,
                        "thesis changed since it was read (version " + snapshot.getVersion()
                            + " → " + locked.getVersion() + ")"));
                }

                int oldScore = locked.getConvictionScore();
                PriceContext priceContext = PriceContextAnalyzer.analyze(request.text(), greenLine);
                ScoreCalculation calc = ScoreMerger.merge(oldScore, analysis, priceContext, request.forcedScore(), policy);
                int newScore = calc.newScore();
                LocalDateTime now = LocalDateTime.now(clock);

                List<String> mergedFields = mergeFacts(locked, request);
                if (newScore != oldScore) {
                    mergedFields.add("convictionScore");
                }
                mergedFields.add("narrative");

                MergeAction action = ScoreMerger.actionFor(oldScore, newScore, analysis);
                if (action == MergeAction.NO_CHANGE && mergedFields.size() > 1) {
                    action = MergeAction.UPDATED;
                }
                MergeAction finalAction = action;

                NarrativeEntry entry = narrativeEntry(ticker, locked.getNarrativeCount() + 1, source,
                    request.text(), analysis.conflicts(), analysis.conflictType(), analysis.path(),
                    oldScore, newScore, now);

                return narrativeRepository.save(entry)
                    .flatMap(savedEntry -> {
                        locked.setNarrativeHeadId(savedEntry.getId());
                        locked.setNarrativeCount(savedEntry.getSequenceNo());
                        locked.setConvictionScore(newScore);
                        locked.setSources(ScoreMerger.appendDistinct(locked.getSources(), source));
                        locked.setLastUpdated(now);
                        return thesisRepository.save(locked);
                    })
                    .flatMap(saved -> appendHistory(ticker, oldScore, newScore, source, now))
                    .flatMap(history -> raiseConflictAlertIfNeeded(ticker, oldScore, newScore, analysis, source))
                    .map(alerted -> new MergeResult(ticker, finalAction, oldScore, newScore,
                        analysis.conflicts(), analysis.conflictType(), analysis.path(),
                        mergedFields, alerted, explain(analysis, calc)));
            });

        return transactionalOperator.transactional(write)
            .onErrorMap(OptimisticLockingFailureException.class,
                e -> new ConcurrencyConflictException(COMPONENT, ticker, "optimistic lock failed", e));
    }

    private Mono<MergeResult> createThesis(String ticker, MergeRequest request, String source) {
        int score = request.forcedScore() != null
            ? ConvictionScore.clamp(request.forcedScore())
            : policy.newThesisScore();

        Mono<MergeResult> write = Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now(clock);

            ThesisRecord fresh = new ThesisRecord();
            fresh.setTicker(ticker);
            fresh.setConvictionScore(score);
            List<String> mergedFields = mergeFacts(fresh, request);
            mergedFields.add("convictionScore");
            mergedFields.add("narrative");
            fresh.setSources(source);
            fresh.setNeedsReview(false);
            fresh.setCreatedAt(now);
            fresh.setLastUpdated(now);

            NarrativeEntry entry = narrativeEntry(ticker, 1, source, request.text(), List.of(),
                ConflictType.NONE, null, null, score, now);

            return narrativeRepository.save(entry)
                .flatMap(savedEntry -> {
                    fresh.setNarrativeHeadId(savedEntry.getId());
                    fresh.setNarrativeCount(savedEntry.getSequenceNo());
                    return thesisRepository.save(fresh);
                })
                .flatMap(saved -> appendHistory(ticker, null, score, source, now))
                .thenReturn(new MergeResult(ticker, MergeAction.CREATED, null, score, List.of(),
                    ConflictType.NONE, null, mergedFields, false,
                    "New thesis created at score " + score));
        });

        return transactionalOperator.transactional(write)
            .onErrorMap(DuplicateKeyException.class,
                e -> new ConcurrencyConflictException(COMPONENT, ticker, "thesis created concurrently", e));
    }

    private Mono<Boolean> raiseConflictAlertIfNeeded(String ticker, int oldScore, int newScore,
                                                     ConflictAnalysis analysis, String source) {
        if (!analysis.conflictType().raisesAlert()) {
            return Mono.just(false);
        }
        return driftMonitor.raiseConflictAlert(ticker, oldScore, newScore, analysis, source)
            .thenReturn(true);
    }

    /**
     * Appends a history row whose timestamp is strictly after the ticker's latest one.
     */
    private Mono<ScoreHistoryEntry> appendHistory(String ticker, Integer oldScore, int newScore,
                                                  String source, LocalDateTime now) {
        return scoreHistoryRepository.findLatest(ticker)
            .map(last -> last.getRecordedAt().isBefore(now) ? now : last.getRecordedAt().plusNanos(1_000))
            .defaultIfEmpty(now)
            .flatMap(recordedAt -> {
                ScoreHistoryEntry entry = new ScoreHistoryEntry();
                entry.setTicker(ticker);
                entry.setScore(newScore);
                entry.setThesisStatus(ThesisStatus.fromDelta(oldScore, newScore).name());
                entry.setSource(source);
                entry.setRecordedAt(recordedAt);
                return scoreHistoryRepository.save(entry);
            });
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private ConflictAnalysis boundAiResult(ConflictAnalysis ai) {
        int bounded = policy.clampAiAdjustment(ai.scoreAdjustment());
        if (bounded == ai.scoreAdjustment()) {
            return ai;
        }
        log.warn("[KnowledgeSynthesis] AI adjustment {} outside policy bounds, clamped to {}", ai.scoreAdjustment(), bounded);
        return new ConflictAnalysis(ai.conflictType(), ai.conflicts(), ai.positiveDevelopments(),
            bounded, ai.explanation(), ClassificationPath.AI);
    }

    /** Merges optional fact additions into {@code thesis}; returns the names of changed fields. */
    private static List<String> mergeFacts(ThesisRecord thesis, MergeRequest request) {
        List<String> changed = new ArrayList<>();
        String edge = ScoreMerger.appendDistinct(thesis.getEdge(), request.edge());
        if (!Objects.equals(edge, thesis.getEdge())) {
            thesis.setEdge(edge);
            changed.add("edge");
        }
        String catalysts = ScoreMerger.appendDistinct(thesis.getCatalysts(), request.catalysts());
        if (!Objects.equals(catalysts, thesis.getCatalysts())) {
            thesis.setCatalysts(catalysts);
            changed.add("catalysts");
        }
        String risks = ScoreMerger.appendDistinct(thesis.getRisks(), request.risks());
        if (!Objects.equals(risks, thesis.getRisks())) {
            thesis.setRisks(risks);
            changed.add("risks");
        }
        if (request.actionVerdict() != null && !request.actionVerdict().isBlank()
                && !request.actionVerdict().equals(thesis.getActionVerdict())) {
            thesis.setActionVerdict(request.actionVerdict().trim());
            changed.add("actionVerdict");
        }
        return changed;
    }

    private NarrativeEntry narrativeEntry(String ticker, int sequenceNo, String source, String text,
                                          List<String> conflicts, ConflictType conflictType,
                                          ClassificationPath path, Integer scoreBefore, int scoreAfter,
                                          LocalDateTime now) {
        NarrativeEntry entry = new NarrativeEntry();
        entry.setTicker(ticker);
        entry.setSequenceNo(sequenceNo);
        entry.setSource(source);
        entry.setContent(truncate(text, policy.narrativeExcerptChars()));
        entry.setConflicts(conflicts.isEmpty() ? null : String.join("; ", conflicts));
        entry.setConflictType(conflictType.name());
        entry.setClassificationPath(path != null ? path.name() : null);
        entry.setScoreBefore(scoreBefore);
        entry.setScoreAfter(scoreAfter);
        entry.setRecordedAt(now);
        return entry;
    }

    static String summarize(ThesisRecord thesis) {
        return String.format("""
            Ticker: %s
            Conviction score: %d/10
            Edge: %s
            Catalysts: %s
            Risks: %s
            Action verdict: %s""",
            thesis.getTicker(), thesis.getConvictionScore(),
            orNone(thesis.getEdge()), orNone(thesis.getCatalysts()),
            orNone(thesis.getRisks()), orNone(thesis.getActionVerdict()));
    }

    private static String explain(ConflictAnalysis analysis, ScoreCalculation calc) {
        StringBuilder sb = new StringBuilder(analysis.explanation() != null ? analysis.explanation() : "");
        if (calc.forced()) {
            sb.append(" | forced score ").append(calc.newScore());
        } else {
            sb.append(String.format(" | adjustment %+d", calc.adjustment()));
            if (calc.bonus() != 0) {
                sb.append(String.format(" | price-context bonus %+d", calc.bonus()));
            }
        }
        return sb.toString();
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "(none)" : value;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}

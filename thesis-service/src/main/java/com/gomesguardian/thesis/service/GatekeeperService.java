package com.gomesguardian.thesis.service;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.gatekeeper.GomesGatekeeper;
import com.gomesguardian.common.model.MarketRegime;
import com.gomesguardian.common.model.PriceLines;
import com.gomesguardian.common.model.TickerSnapshot;
import com.gomesguardian.common.model.Verdict;
import com.gomesguardian.thesis.dto.StoredEvaluationRequest;
import com.gomesguardian.thesis.model.ThesisRecord;
import com.gomesguardian.thesis.model.VerdictRecord;
import com.gomesguardian.thesis.repository.ThesisRepository;
import com.gomesguardian.thesis.repository.VerdictRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Reactive entry points to {@link GomesGatekeeper}.
 *
 * <p>{@link #evaluate} is the pure path: the caller supplies the whole snapshot and
 * nothing is stored. {@link #evaluateStored} assembles the snapshot from the stored
 * thesis, the current regime and the current price lines, then appends the verdict
 * to the verdict log.
 */
@Service
public class GatekeeperService {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperService.class);

    private final GomesGatekeeper gatekeeper;
    private final ThesisRepository thesisRepository;
    private final VerdictRepository verdictRepository;
    private final MarketRegimeService marketRegimeService;
    private final PriceLinesService priceLinesService;
    private final Clock clock;

    public GatekeeperService(GomesGatekeeper gatekeeper,
                             ThesisRepository thesisRepository,
                             VerdictRepository verdictRepository,
                             MarketRegimeService marketRegimeService,
                             PriceLinesService priceLinesService,
                             Clock clock) {
        this.gatekeeper = gatekeeper;
        this.thesisRepository = thesisRepository;
        this.verdictRepository = verdictRepository;
        this.marketRegimeService = marketRegimeService;
        this.priceLinesService = priceLinesService;
        this.clock = clock;
    }

    public Mono<Verdict> evaluate(TickerSnapshot snapshot) {
        return Mono.fromCallable(() -> gatekeeper.evaluate(snapshot))
            .doOnSuccess(this::logVerdict);
    }

    /**
     * @return the verdict, or empty when no thesis exists for the ticker
     */
    public Mono<Verdict> evaluateStored(String ticker, StoredEvaluationRequest request) {
        if (ticker == null || ticker.isBlank()) {
            return Mono.error(new InputRejectedException("Gatekeeper", "ticker is required"));
        }
        if (request == null) {
            return Mono.error(new InputRejectedException("Gatekeeper", "evaluation facts are required"));
        }
        String t = GomesGatekeeper.normalizeTicker(ticker);

        Mono<ThesisRecord> thesis = thesisRepository.findByTicker(t);
        Mono<MarketRegime> regime = marketRegimeService.currentRegime();
        Mono<Optional<PriceLines>> lines = priceLinesService.currentLines(t)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());

        return Mono.zip(thesis, regime, lines)
            .map(tuple -> new TickerSnapshot(
                t,
                tuple.getT2(),
                tuple.getT1().toView(),
                tuple.getT3().orElse(null),
                request.currentPrice(),
                LocalDate.now(clock),
                request.earningsDate(),
                request.held(),
                request.regimeOverride(),
                request.hasRecentCatalyst(),
                request.daysToNextCatalyst(),
                request.cashRunwayMonths(),
                request.trailingVolatility(),
                request.mlUpConfidence()))
            .map(gatekeeper::evaluate)
            .flatMap(verdict -> verdictRepository.save(VerdictRecord.from(verdict, LocalDateTime.now(clock)))
                .thenReturn(verdict))
            .doOnSuccess(this::logVerdict)
            .doOnError(e -> log.error("[Gatekeeper] Stored evaluation failed. ticker={}", t, e));
    }

    public Flux<VerdictRecord> recentVerdicts(String ticker, int limit) {
        if (limit < 1) {
            return Flux.error(new InputRejectedException("Gatekeeper", "limit must be at least 1, got " + limit));
        }
        return verdictRepository.findRecent(GomesGatekeeper.normalizeTicker(ticker), limit);
    }

    private void logVerdict(Verdict v) {
        if (v == null) {
            return;
        }
        log.info("[Gatekeeper] Verdict. ticker={} decision={} score={} maxPositionPct={} phase={} zone={} regime={} blockedReason={} risks={}",
                 v.ticker(), v.decision(), v.gomesScore(), v.maxPositionPct(), v.lifecyclePhase(),
                 v.zoneSignal(), v.regime(), v.blockedReason(), v.riskFactors());
    }
}

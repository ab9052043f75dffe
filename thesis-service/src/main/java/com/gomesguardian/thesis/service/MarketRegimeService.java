package com.gomesguardian.thesis.service;

import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.model.MarketRegime;
import com.gomesguardian.common.regime.MarketAlertSystem;
import com.gomesguardian.common.regime.RegimeTransition;
import com.gomesguardian.thesis.dto.MarketRegimeDTO;
import com.gomesguardian.thesis.model.MarketRegimeChange;
import com.gomesguardian.thesis.model.MarketRegimeState;
import com.gomesguardian.thesis.repository.MarketRegimeChangeRepository;
import com.gomesguardian.thesis.repository.MarketRegimeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Owns the single global market regime row and its change log.
 *
 * <p>Every write locks the row, appends a {@link MarketRegimeChange} and bumps the
 * version in one transaction. Reads never fail: when no regime was ever set,
 * {@link MarketAlertSystem#DEFAULT_REGIME} is reported.
 */
@Service
public class MarketRegimeService {

    private static final Logger log = LoggerFactory.getLogger(MarketRegimeService.class);

    private final MarketRegimeRepository regimeRepository;
    private final MarketRegimeChangeRepository changeRepository;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    public MarketRegimeService(MarketRegimeRepository regimeRepository,
                               MarketRegimeChangeRepository changeRepository,
                               TransactionalOperator transactionalOperator,
                               Clock clock) {
        this.regimeRepository = regimeRepository;
        this.changeRepository = changeRepository;
        this.transactionalOperator = transactionalOperator;
        this.clock = clock;
    }

    public Mono<MarketRegime> currentRegime() {
        return regimeRepository.findCurrent()
            .map(state -> MarketRegime.valueOf(state.getRegime()))
            .defaultIfEmpty(MarketAlertSystem.DEFAULT_REGIME);
    }

    public Mono<MarketRegimeDTO> current() {
        return regimeRepository.findCurrent()
            .map(MarketRegimeService::toDto)
            .defaultIfEmpty(defaultDto());
    }

    /**
     * Operator write of the global regime.
     *
     * @return the recorded transition
     */
    public Mono<RegimeTransition> setRegime(MarketRegime next, String note, String changedBy) {
        if (next == null) {
            return Mono.error(new InputRejectedException("MarketRegime", "regime is required"));
        }
        Mono<RegimeTransition> write = Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            return regimeRepository.lockCurrent()
                .map(state -> Optional.of(MarketRegime.valueOf(state.getRegime())))
                .defaultIfEmpty(Optional.empty())
                .flatMap(current -> {
                    RegimeTransition transition = MarketAlertSystem.transition(current.orElse(null), next, note);
                    return regimeRepository.upsert(next.name(), note, changedBy, now)
                        .then(changeRepository.save(toChange(transition, changedBy, now)))
                        .thenReturn(transition);
                });
        });

        return transactionalOperator.transactional(write)
            .doOnSuccess(t -> {
                if (t.escalation()) {
                    log.warn("[MarketRegime] Regime escalated. from={} to={} by={} note={}",
                             t.from(), t.to(), changedBy, note);
                } else {
                    log.info("[MarketRegime] Regime set. from={} to={} by={} note={}",
                             t.from(), t.to(), changedBy, note);
                }
            })
            .doOnError(e -> log.error("[MarketRegime] Regime write failed. to={}", next, e));
    }

    public Flux<MarketRegimeChange> history(int limit) {
        if (limit < 1) {
            return Flux.error(new InputRejectedException("MarketRegime", "limit must be at least 1, got " + limit));
        }
        return changeRepository.findRecent(limit);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static MarketRegimeChange toChange(RegimeTransition transition, String changedBy, LocalDateTime at) {
        MarketRegimeChange change = new MarketRegimeChange();
        change.setFromRegime(transition.from() != null ? transition.from().name() : null);
        change.setToRegime(transition.to().name());
        change.setNote(transition.note());
        change.setEscalation(transition.escalation());
        change.setChangedBy(changedBy);
        change.setChangedAt(at);
        return change;
    }

    private static MarketRegimeDTO toDto(MarketRegimeState state) {
        MarketRegime regime = MarketRegime.valueOf(state.getRegime());
        return new MarketRegimeDTO(regime, regime.mode(), regime.description(),
            MarketAlertSystem.allocation(regime), state.getNote(), state.getVersion(),
            state.getUpdatedBy(), state.getUpdatedAt());
    }

    private static MarketRegimeDTO defaultDto() {
        MarketRegime regime = MarketAlertSystem.DEFAULT_REGIME;
        return new MarketRegimeDTO(regime, regime.mode(), regime.description(),
            MarketAlertSystem.allocation(regime), null, null, null, null);
    }
}

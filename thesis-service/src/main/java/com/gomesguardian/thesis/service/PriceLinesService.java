package com.gomesguardian.thesis.service;

import com.gomesguardian.common.exception.ConcurrencyConflictException;
import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.common.gatekeeper.GomesGatekeeper;
import com.gomesguardian.common.model.PriceLines;
import com.gomesguardian.thesis.model.PriceLinesRecord;
import com.gomesguardian.thesis.repository.PriceLinesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Versioned price lines per ticker. Setting new lines retires the current version
 * and inserts a new one; old versions stay as history.
 */
@Service
public class PriceLinesService {

    private static final Logger log = LoggerFactory.getLogger(PriceLinesService.class);

    private final PriceLinesRepository priceLinesRepository;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    public PriceLinesService(PriceLinesRepository priceLinesRepository,
                             TransactionalOperator transactionalOperator,
                             Clock clock) {
        this.priceLinesRepository = priceLinesRepository;
        this.transactionalOperator = transactionalOperator;
        this.clock = clock;
    }

    /**
     * @throws InputRejectedException (as an error signal) when a line is missing,
     *         not positive, or {@code green >= red}
     * @throws ConcurrencyConflictException (as an error signal) when another write
     *         for the same ticker inserted its current version first
     */
    public Mono<PriceLinesRecord> setPriceLines(String ticker, Double green, Double red,
                                                Double grey, String source) {
        return Mono.fromCallable(() -> {
                if (ticker == null || ticker.isBlank()) {
                    throw new InputRejectedException("PriceLines", "ticker is required");
                }
                if (green == null || red == null) {
                    throw new InputRejectedException("PriceLines", "green and red lines are required");
                }
                return new PriceLines(green, red, grey);
            })
            .flatMap(lines -> {
                String t = GomesGatekeeper.normalizeTicker(ticker);
                LocalDateTime now = LocalDateTime.now(clock);
                PriceLinesRecord record = new PriceLinesRecord();
                record.setTicker(t);
                record.setGreenLine(lines.greenLine());
                record.setRedLine(lines.redLine());
                record.setGreyLine(lines.greyLine());
                record.setSource(source);
                record.setEffectiveFrom(now);
                return transactionalOperator.transactional(
                        priceLinesRepository.closeCurrent(t, now)
                            .then(priceLinesRepository.save(record)))
                    .onErrorMap(DuplicateKeyException.class,
                        e -> new ConcurrencyConflictException("PriceLines", t, "lines set concurrently", e));
            })
            .doOnSuccess(r -> log.info("[PriceLines] Lines set. ticker={} green={} red={} grey={} source={}",
                                       r.getTicker(), r.getGreenLine(), r.getRedLine(), r.getGreyLine(), source))
            .doOnError(e -> log.warn("[PriceLines] Lines rejected or not stored. ticker={} reason={}",
                                     ticker, e.getMessage()));
    }

    public Mono<PriceLinesRecord> current(String ticker) {
        return priceLinesRepository.findCurrent(GomesGatekeeper.normalizeTicker(ticker));
    }

    /** Current lines as the core value type; empty when none are set. */
    public Mono<PriceLines> currentLines(String ticker) {
        return current(ticker).map(PriceLinesRecord::toPriceLines);
    }

    public Flux<PriceLinesRecord> history(String ticker) {
        return priceLinesRepository.findHistory(GomesGatekeeper.normalizeTicker(ticker));
    }
}

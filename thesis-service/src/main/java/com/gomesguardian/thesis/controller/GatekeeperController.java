package com.gomesguardian.thesis.controller;

import com.gomesguardian.common.model.TickerSnapshot;
import com.gomesguardian.common.model.Verdict;
import com.gomesguardian.thesis.dto.StoredEvaluationRequest;
import com.gomesguardian.thesis.model.VerdictRecord;
import com.gomesguardian.thesis.service.GatekeeperService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/gatekeeper")
public class GatekeeperController {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperController.class);

    private final GatekeeperService gatekeeperService;

    public GatekeeperController(GatekeeperService gatekeeperService) {
        this.gatekeeperService = gatekeeperService;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<Verdict>> evaluate(@RequestBody TickerSnapshot snapshot) {
        log.info("Snapshot evaluation received. ticker={}", snapshot.ticker());
        return gatekeeperService.evaluate(snapshot)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/evaluate/{ticker}")
    public Mono<ResponseEntity<Verdict>> evaluateStored(@PathVariable String ticker,
                                                        @RequestBody StoredEvaluationRequest request) {
        log.info("Stored-state evaluation received. ticker={}", ticker);
        return gatekeeperService.evaluateStored(ticker, request)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/verdicts/{ticker}")
    public Flux<VerdictRecord> verdicts(@PathVariable String ticker,
                                        @RequestParam(defaultValue = "20") int limit) {
        log.info("Verdict history requested. ticker={} limit={}", ticker, limit);
        return gatekeeperService.recentVerdicts(ticker, limit);
    }
}

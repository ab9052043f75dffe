package com.gomesguardian.thesis.controller;

import com.gomesguardian.common.drift.AlertSeverity;
import com.gomesguardian.common.drift.ThesisDriftResult;
import com.gomesguardian.common.exception.InputRejectedException;
import com.gomesguardian.thesis.dto.DriftRequest;
import com.gomesguardian.thesis.model.DriftAlert;
import com.gomesguardian.thesis.model.ThesisRecord;
import com.gomesguardian.thesis.service.ThesisDriftMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/drift")
public class DriftController {

    private static final Logger log = LoggerFactory.getLogger(DriftController.class);

    private final ThesisDriftMonitor driftMonitor;

    public DriftController(ThesisDriftMonitor driftMonitor) {
        this.driftMonitor = driftMonitor;
    }

    @PostMapping("/{ticker}/analyze")
    public Mono<ResponseEntity<ThesisDriftResult>> analyze(@PathVariable String ticker,
                                                           @RequestBody DriftRequest request) {
        if (request.newScore() == null) {
            return Mono.error(new InputRejectedException("DriftMonitor", "newScore is required"));
        }
        log.info("Drift analysis received. ticker={} previous={} new={}",
                 ticker, request.previousScore(), request.newScore());
        return driftMonitor.analyzeDrift(ticker, request.previousScore(), request.newScore(),
                                         request.source(), request.currentPrice())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/alerts")
    public Flux<DriftAlert> pending(@RequestParam(required = false) AlertSeverity severity,
                                    @RequestParam(defaultValue = "50") int limit) {
        return driftMonitor.pendingAlerts(severity, limit);
    }

    @GetMapping("/alerts/{ticker}")
    public Flux<DriftAlert> alertsFor(@PathVariable String ticker) {
        return driftMonitor.alertsFor(ticker);
    }

    @PostMapping("/alerts/{id}/acknowledge")
    public Mono<ResponseEntity<DriftAlert>> acknowledge(@PathVariable Long id) {
        log.info("Alert acknowledgement received. id={}", id);
        return driftMonitor.acknowledge(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/needs-review")
    public Flux<ThesisRecord> needsReview() {
        return driftMonitor.needingReview();
    }
}

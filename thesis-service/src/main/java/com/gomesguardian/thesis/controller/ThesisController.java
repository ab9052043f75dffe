package com.gomesguardian.thesis.controller;

import com.gomesguardian.common.synthesis.MergeResult;
import com.gomesguardian.thesis.dto.MergeRequest;
import com.gomesguardian.thesis.model.NarrativeEntry;
import com.gomesguardian.thesis.model.ScoreHistoryEntry;
import com.gomesguardian.thesis.model.ThesisRecord;
import com.gomesguardian.thesis.service.KnowledgeSynthesisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Thesis reads and the merge operation. Merge is the only write path.
 */
@RestController
@RequestMapping("/api/v1/thesis")
public class ThesisController {

    private static final Logger log = LoggerFactory.getLogger(ThesisController.class);

    private final KnowledgeSynthesisService synthesisService;

    public ThesisController(KnowledgeSynthesisService synthesisService) {
        this.synthesisService = synthesisService;
    }

    @PostMapping("/{ticker}/merge")
    public Mono<ResponseEntity<MergeResult>> merge(@PathVariable String ticker,
                                                   @RequestBody MergeRequest request) {
        log.info("Merge received. ticker={} source={}", ticker, request.source());
        return synthesisService.merge(ticker, request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{ticker}")
    public Mono<ResponseEntity<ThesisRecord>> thesis(@PathVariable String ticker) {
        return synthesisService.thesis(ticker)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{ticker}/narrative")
    public Flux<NarrativeEntry> narrative(@PathVariable String ticker) {
        return synthesisService.narrative(ticker);
    }

    @GetMapping("/{ticker}/score-history")
    public Flux<ScoreHistoryEntry> scoreHistory(@PathVariable String ticker,
                                                @RequestParam(defaultValue = "50") int limit) {
        return synthesisService.scoreHistory(ticker, limit);
    }
}

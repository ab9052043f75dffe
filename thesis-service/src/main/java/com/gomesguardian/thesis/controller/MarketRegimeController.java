package com.gomesguardian.thesis.controller;

import com.gomesguardian.common.regime.RegimeTransition;
import com.gomesguardian.thesis.dto.MarketRegimeDTO;
import com.gomesguardian.thesis.dto.MarketRegimeRequest;
import com.gomesguardian.thesis.model.MarketRegimeChange;
import com.gomesguardian.thesis.service.MarketRegimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/market-regime")
public class MarketRegimeController {

    private static final Logger log = LoggerFactory.getLogger(MarketRegimeController.class);

    private final MarketRegimeService marketRegimeService;

    public MarketRegimeController(MarketRegimeService marketRegimeService) {
        this.marketRegimeService = marketRegimeService;
    }

    @GetMapping
    public Mono<MarketRegimeDTO> current() {
        return marketRegimeService.current();
    }

    @PutMapping
    public Mono<ResponseEntity<RegimeTransition>> set(@RequestBody MarketRegimeRequest request) {
        log.info("Regime change received. regime={} by={}", request.regime(), request.changedBy());
        return marketRegimeService.setRegime(request.regime(), request.note(), request.changedBy())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Flux<MarketRegimeChange> history(@RequestParam(defaultValue = "50") int limit) {
        return marketRegimeService.history(limit);
    }
}

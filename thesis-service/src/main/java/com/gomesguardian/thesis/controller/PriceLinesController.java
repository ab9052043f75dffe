package com.gomesguardian.thesis.controller;

import com.gomesguardian.thesis.dto.PriceLinesRequest;
import com.gomesguardian.thesis.model.PriceLinesRecord;
import com.gomesguardian.thesis.service.PriceLinesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/price-lines")
public class PriceLinesController {

    private static final Logger log = LoggerFactory.getLogger(PriceLinesController.class);

    private final PriceLinesService priceLinesService;

    public PriceLinesController(PriceLinesService priceLinesService) {
        this.priceLinesService = priceLinesService;
    }

    @PutMapping("/{ticker}")
    public Mono<ResponseEntity<PriceLinesRecord>> set(@PathVariable String ticker,
                                                      @RequestBody PriceLinesRequest request) {
        log.info("Price lines received. ticker={} green={} red={}", ticker, request.greenLine(), request.redLine());
        return priceLinesService.setPriceLines(ticker, request.greenLine(), request.redLine(),
                                               request.greyLine(), request.source())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{ticker}")
    public Mono<ResponseEntity<PriceLinesRecord>> current(@PathVariable String ticker) {
        return priceLinesService.current(ticker)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{ticker}/history")
    public Flux<PriceLinesRecord> history(@PathVariable String ticker) {
        return priceLinesService.history(ticker);
    }
}

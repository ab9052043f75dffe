package com.gomesguardian.thesis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gomesguardian.common.gatekeeper.GatekeeperPolicy;
import com.gomesguardian.common.gatekeeper.GomesGatekeeper;
import com.gomesguardian.common.synthesis.SynthesisPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;

@Configuration
public class ThesisServiceConfig {

    // ── gatekeeper ───────────────────────────────────────────────────────────

    @Value("${gomes.gatekeeper.earnings-blackout-days:14}")
    private int earningsBlackoutDays;

    @Value("${gomes.gatekeeper.assume-earnings-imminent-when-unknown:true}")
    private boolean assumeEarningsImminentWhenUnknown;

    @Value("${gomes.gatekeeper.green-cap-multiplier:1.0}")
    private double greenCapMultiplier;

    @Value("${gomes.gatekeeper.yellow-cap-multiplier:1.0}")
    private double yellowCapMultiplier;

    @Value("${gomes.gatekeeper.orange-cap-multiplier:0.5}")
    private double orangeCapMultiplier;

    @Value("${gomes.gatekeeper.red-override-cap-multiplier:0.25}")
    private double redOverrideCapMultiplier;

    @Value("${gomes.gatekeeper.min-expected-loss-pct:10.0}")
    private double minExpectedLossPct;

    @Value("${gomes.gatekeeper.volatility-threshold:0.05}")
    private double volatilityThreshold;

    @Value("${gomes.gatekeeper.ml-fusion-weight:0.2}")
    private double mlFusionWeight;

    // ── synthesis ────────────────────────────────────────────────────────────

    @Value("${gomes.synthesis.ai-timeout-ms:4000}")
    private long aiTimeoutMs;

    @Value("${gomes.synthesis.max-merge-retries:3}")
    private int maxMergeRetries;

    @Value("${gomes.synthesis.price-context-bonus:1}")
    private int priceContextBonus;

    @Value("${gomes.synthesis.new-thesis-score:5}")
    private int newThesisScore;

    @Value("${gomes.synthesis.min-ai-adjustment:-4}")
    private int minAiAdjustment;

    @Value("${gomes.synthesis.max-ai-adjustment:2}")
    private int maxAiAdjustment;

    @Value("${gomes.synthesis.max-classified-chars:5000}")
    private int maxClassifiedChars;

    @Value("${gomes.synthesis.narrative-excerpt-chars:500}")
    private int narrativeExcerptChars;

    @Bean
    public GatekeeperPolicy gatekeeperPolicy() {
        return new GatekeeperPolicy(earningsBlackoutDays, assumeEarningsImminentWhenUnknown,
            greenCapMultiplier, yellowCapMultiplier, orangeCapMultiplier, redOverrideCapMultiplier,
            minExpectedLossPct, volatilityThreshold, mlFusionWeight);
    }

    @Bean
    public GomesGatekeeper gomesGatekeeper(GatekeeperPolicy gatekeeperPolicy) {
        return new GomesGatekeeper(gatekeeperPolicy);
    }

    @Bean
    public SynthesisPolicy synthesisPolicy() {
        return new SynthesisPolicy(aiTimeoutMs, maxMergeRetries, priceContextBonus, newThesisScore,
            minAiAdjustment, maxAiAdjustment, maxClassifiedChars, narrativeExcerptChars);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

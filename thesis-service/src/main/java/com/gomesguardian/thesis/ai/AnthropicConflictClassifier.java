package com.gomesguardian.thesis.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gomesguardian.common.exception.CollaboratorUnavailableException;
import com.gomesguardian.common.synthesis.ClassificationPath;
import com.gomesguardian.common.synthesis.ConflictAnalysis;
import com.gomesguardian.common.synthesis.ConflictType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conflict classification through the Anthropic Messages API.
 *
 * <p>Fully reactive; no {@code .block()}. Every failure (missing key, transport
 * error, unparseable answer) surfaces as a {@link CollaboratorUnavailableException}
 * error signal so that the caller's keyword fallback takes over. The timeout is
 * applied by the caller.
 */
@Service
public class AnthropicConflictClassifier implements ThesisConflictClassifier {

    private static final Logger log = LoggerFactory.getLogger(AnthropicConflictClassifier.class);

    private static final String COMPONENT = "AIConflictClassifier";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.model:claude-haiku-4-5-20251001}")
    private String model;

    @Value("${anthropic.max-tokens:600}")
    private int maxTokens;

    public AnthropicConflictClassifier(WebClient.Builder builder, ObjectMapper objectMapper) {
        this.anthropicClient = builder
            .baseUrl("https://api.anthropic.com")
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ConflictAnalysis> classify(String existingSummary, String newText) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            return Mono.error(new CollaboratorUnavailableException(COMPONENT, "no Anthropic API key configured"));
        }
        return Mono.fromCallable(() -> buildPrompt(existingSummary, newText))
            .flatMap(this::callAnthropicApi)
            .map(this::parseResponse)
            .doOnSuccess(a -> log.info("[AIConflictClassifier] Classified. conflictType={} adjustment={} conflicts={}",
                                       a.conflictType(), a.scoreAdjustment(), a.conflicts().size()));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildPrompt(String existingSummary, String newText) {
        return String.format("""
            You are reviewing an existing investment thesis against newly arrived information.

            EXISTING THESIS:
            %s

            NEW INFORMATION:
            %s

            Identify contradictions between the new information and the thesis edge,
            catalysts and risks. Respond with ONLY a JSON object:
            {
              "conflict_type": "NONE" | "MINOR" | "SIGNIFICANT" | "CRITICAL",
              "conflicts": ["..."],
              "positive_developments": ["..."],
              "score_adjustment": integer between -3 and 2,
              "explanation": "one or two sentences"
            }
            """, existingSummary, newText);
    }

    // ── Anthropic API call ────────────────────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", anthropicApiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(response -> {
                try {
                    JsonNode root = objectMapper.readTree(response);
                    return root.path("content").get(0).path("text").asText();
                } catch (Exception e) {
                    throw new CollaboratorUnavailableException(COMPONENT, "unexpected Anthropic response shape", e);
                }
            });
    }

    // ── response parsing ──────────────────────────────────────────────────────

    ConflictAnalysis parseResponse(String responseText) {
        JsonNode json;
        try {
            String cleaned = responseText
                .replaceAll("```json", "")
                .replaceAll("```", "")
                .trim();
            json = objectMapper.readTree(cleaned);
        } catch (Exception e) {
            throw new CollaboratorUnavailableException(COMPONENT, "unparseable classification", e);
        }
        if (json == null || !json.hasNonNull("score_adjustment")) {
            throw new CollaboratorUnavailableException(COMPONENT, "classification lacks score_adjustment");
        }

        int adjustment = json.path("score_adjustment").asInt(0);
        ConflictType type = parseConflictType(json.path("conflict_type").asText(null), adjustment);

        return new ConflictAnalysis(
            type,
            textList(json.path("conflicts")),
            textList(json.path("positive_developments")),
            adjustment,
            json.path("explanation").asText("No explanation provided"),
            ClassificationPath.AI);
    }

    private static ConflictType parseConflictType(String raw, int adjustment) {
        if (raw == null || raw.isBlank()) {
            return ConflictType.fromAdjustment(adjustment);
        }
        try {
            return ConflictType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("[AIConflictClassifier] Unknown conflict_type '{}', deriving from adjustment={}", raw, adjustment);
            return ConflictType.fromAdjustment(adjustment);
        }
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(n -> {
                String s = n.asText("");
                if (!s.isBlank()) {
                    out.add(s);
                }
            });
        }
        return out;
    }
}

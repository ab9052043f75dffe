package com.gomesguardian.thesis.ai;

import com.gomesguardian.common.synthesis.ConflictAnalysis;
import reactor.core.publisher.Mono;

/**
 * Classifies new information against a stored thesis.
 *
 * <p>Implementations may be slow or fail. Callers bound every call with a timeout
 * and fall back to {@link com.gomesguardian.common.synthesis.KeywordConflictDetector}.
 */
public interface ThesisConflictClassifier {

    Mono<ConflictAnalysis> classify(String existingSummary, String newText);
}

package com.gomesguardian.common.synthesis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic conflict detection used whenever the AI classifier is unavailable.
 *
 * <p>Scans the lower-cased text for a fixed table of negative and positive terms,
 * sums their adjustments and classifies the signed total with
 * {@link ConflictType#fromAdjustment}. Each term counts once regardless of how
 * often it occurs.
 */
public final class KeywordConflictDetector {

    private record Term(int adjustment, String description) {}

    private static final Map<String, Term> NEGATIVE_TERMS = new LinkedHashMap<>();
    private static final Map<String, Term> POSITIVE_TERMS = new LinkedHashMap<>();

    static {
        NEGATIVE_TERMS.put("delay",             new Term(-1, "Delay mentioned"));
        NEGATIVE_TERMS.put("postponed",         new Term(-1, "Postponement mentioned"));
        NEGATIVE_TERMS.put("missed",            new Term(-2, "Missed target/deadline"));
        NEGATIVE_TERMS.put("downgrade",         new Term(-2, "Downgrade mentioned"));
        NEGATIVE_TERMS.put("cut guidance",      new Term(-2, "Guidance cut"));
        NEGATIVE_TERMS.put("lowered guidance",  new Term(-2, "Guidance lowered"));
        NEGATIVE_TERMS.put("disappointing",     new Term(-1, "Disappointing results"));
        NEGATIVE_TERMS.put("lawsuit",           new Term(-1, "Legal issues"));
        NEGATIVE_TERMS.put("sec investigation", new Term(-2, "SEC investigation"));
        NEGATIVE_TERMS.put("fraud",             new Term(-3, "Fraud allegations"));
        NEGATIVE_TERMS.put("bankruptcy",        new Term(-4, "Bankruptcy risk"));
        NEGATIVE_TERMS.put("dilution",          new Term(-1, "Dilution mentioned"));

        POSITIVE_TERMS.put("beat expectations", new Term(1, "Beat expectations"));
        POSITIVE_TERMS.put("raised guidance",   new Term(1, "Guidance raised"));
        POSITIVE_TERMS.put("ahead of schedule", new Term(1, "Ahead of schedule"));
        POSITIVE_TERMS.put("major contract",    new Term(1, "Major contract"));
        POSITIVE_TERMS.put("fda approval",      new Term(2, "FDA approval"));
    }

    private KeywordConflictDetector() {}

    public static ConflictAnalysis analyze(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);

        int total = 0;
        List<String> conflicts = new ArrayList<>();
        List<String> positives = new ArrayList<>();

        for (Map.Entry<String, Term> e : NEGATIVE_TERMS.entrySet()) {
            if (lower.contains(e.getKey())) {
                total += e.getValue().adjustment();
                conflicts.add(e.getValue().description());
            }
        }
        for (Map.Entry<String, Term> e : POSITIVE_TERMS.entrySet()) {
            if (lower.contains(e.getKey())) {
                total += e.getValue().adjustment();
                positives.add(e.getValue().description());
            }
        }

        return new ConflictAnalysis(
            ConflictType.fromAdjustment(total),
            conflicts,
            positives,
            total,
            String.format("Rule-based analysis: %d issues found", conflicts.size()),
            ClassificationPath.FALLBACK);
    }
}

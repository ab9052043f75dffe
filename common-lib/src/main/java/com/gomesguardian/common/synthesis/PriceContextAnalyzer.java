package com.gomesguardian.common.synthesis;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the first price mentioned in free text ({@code $12.50},
 * {@code 12.50 dollars}, {@code priced at 12.50}) and relates it to the green line.
 *
 * <pre>
 *   price &lt; green × 0.95   → BELOW_GREEN
 *   price &lt; green × 1.05   → AT_GREEN
 *   otherwise              → ABOVE_GREEN
 * </pre>
 */
public final class PriceContextAnalyzer {

    private static final List<Pattern> PRICE_PATTERNS = List.of(
        Pattern.compile("\\$(\\d+(?:\\.\\d{1,2})?)"),
        Pattern.compile("(\\d+(?:\\.\\d{1,2})?)\\s*dollars?"),
        Pattern.compile("priced?\\s+(?:at|to|of)\\s+\\$?(\\d+(?:\\.\\d{1,2})?)")
    );

    private static final List<String> BULLISH_TERMS =
        List.of("support", "bounce", "breakout", "accumulating", "buying");

    public static final double BELOW_FACTOR = 0.95;
    public static final double AT_FACTOR    = 1.05;

    private PriceContextAnalyzer() {}

    /**
     * @param greenLine current green line of the ticker; null when none is set
     */
    public static PriceContext analyze(String text, Double greenLine) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        boolean bullish = BULLISH_TERMS.stream().anyMatch(lower::contains);

        Double price = extractPrice(lower);
        if (price == null || greenLine == null || !(greenLine > 0)) {
            return new PriceContext(price, PriceRelation.UNKNOWN, bullish);
        }

        PriceRelation relation;
        if (price < greenLine * BELOW_FACTOR)   relation = PriceRelation.BELOW_GREEN;
        else if (price < greenLine * AT_FACTOR) relation = PriceRelation.AT_GREEN;
        else                                    relation = PriceRelation.ABOVE_GREEN;

        return new PriceContext(price, relation, bullish);
    }

    static Double extractPrice(String text) {
        for (Pattern pattern : PRICE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                double value = Double.parseDouble(m.group(1));
                if (value > 0) {
                    return value;
                }
            }
        }
        return null;
    }
}

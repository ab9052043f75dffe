package com.gomesguardian.common.synthesis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceContextAnalyzerTest {

    @Test
    @DisplayName("$9.80 with support language, green 10 → AT_GREEN, qualifies")
    void atGreen() {
        PriceContext ctx = PriceContextAnalyzer.analyze("Holding support at $9.80 after the dip", 10.0);
        assertEquals(9.8, ctx.mentionedPrice(), 1e-9);
        assertEquals(PriceRelation.AT_GREEN, ctx.relation());
        assertTrue(ctx.bullishLanguage());
        assertTrue(ctx.qualifiesForBonus());
    }

    @Test
    @DisplayName("$8 breakout, green 10 → BELOW_GREEN, qualifies")
    void belowGreen() {
        PriceContext ctx = PriceContextAnalyzer.analyze("Breakout from $8 base", 10.0);
        assertEquals(PriceRelation.BELOW_GREEN, ctx.relation());
        assertTrue(ctx.qualifiesForBonus());
    }

    @Test
    @DisplayName("$12 with bullish language, green 10 → ABOVE_GREEN, no bonus")
    void aboveGreen() {
        PriceContext ctx = PriceContextAnalyzer.analyze("Insiders buying at $12", 10.0);
        assertEquals(PriceRelation.ABOVE_GREEN, ctx.relation());
        assertFalse(ctx.qualifiesForBonus());
    }

    @Test
    @DisplayName("price at green without bullish language → no bonus")
    void notBullish() {
        assertFalse(PriceContextAnalyzer.analyze("Trading at $10 flat", 10.0).qualifiesForBonus());
    }

    @Test
    @DisplayName("no green line → UNKNOWN relation")
    void noGreenLine() {
        PriceContext ctx = PriceContextAnalyzer.analyze("Bounce to $9", null);
        assertEquals(PriceRelation.UNKNOWN, ctx.relation());
        assertFalse(ctx.qualifiesForBonus());
    }

    @Test
    @DisplayName("extractPrice(): $, dollars, and priced-at forms")
    void extraction() {
        assertEquals(12.5, PriceContextAnalyzer.extractPrice("target $12.50"), 1e-9);
        assertEquals(12.0, PriceContextAnalyzer.extractPrice("near 12 dollars"), 1e-9);
        assertEquals(10.2, PriceContextAnalyzer.extractPrice("offering priced at 10.2"), 1e-9);
        assertNull(PriceContextAnalyzer.extractPrice("no figures here"));
    }
}

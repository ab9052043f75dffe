package com.gomesguardian.common.synthesis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Price mentioned in new information, its relation to the green line and
 * whether the surrounding language is bullish.
 */
public record PriceContext(
    @JsonProperty("mentionedPrice")  Double mentionedPrice,
    @JsonProperty("relation")        PriceRelation relation,
    @JsonProperty("bullishLanguage") boolean bullishLanguage
) {
    public static PriceContext none(boolean bullishLanguage) {
        return new PriceContext(null, PriceRelation.UNKNOWN, bullishLanguage);
    }

    /** Bullish language while the price sits at or below the green line. */
    public boolean qualifiesForBonus() {
        return bullishLanguage
            && (relation == PriceRelation.AT_GREEN || relation == PriceRelation.BELOW_GREEN);
    }
}

package com.gomesguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gomesguardian.common.exception.InputRejectedException;

/**
 * Per-ticker green (undervalued), red (fair value / sell) and optional grey
 * (reference) price lines. A constructed instance always satisfies
 * {@code 0 < green < red}.
 */
public record PriceLines(
    @JsonProperty("greenLine") double greenLine,
    @JsonProperty("redLine")   double redLine,
    @JsonProperty("greyLine")  Double greyLine
) {
    public PriceLines {
        if (!Double.isFinite(greenLine) || !Double.isFinite(redLine)
                || (greyLine != null && !Double.isFinite(greyLine))) {
            throw new InputRejectedException("PriceLines",
                String.format("lines must be finite, got green=%s red=%s grey=%s", greenLine, redLine, greyLine));
        }
        if (!(greenLine > 0) || !(redLine > 0)) {
            throw new InputRejectedException("PriceLines",
                String.format("lines must be positive, got green=%s red=%s", greenLine, redLine));
        }
        if (greenLine >= redLine) {
            throw new InputRejectedException("PriceLines",
                String.format("green line must be below red line, got green=%s red=%s", greenLine, redLine));
        }
        if (greyLine != null && !(greyLine > 0)) {
            throw new InputRejectedException("PriceLines", "grey line must be positive, got " + greyLine);
        }
    }

    public static PriceLines of(double greenLine, double redLine) {
        return new PriceLines(greenLine, redLine, null);
    }
}

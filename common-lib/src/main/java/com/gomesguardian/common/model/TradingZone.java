package com.gomesguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of {@link com.gomesguardian.common.zone.TradingZoneEngine}.
 * All fields are null when the price or lines were unavailable.
 *
 * @param maxBuyPrice         buy ceiling (green line + tolerance)
 * @param startSellPrice      sell floor (red line - tolerance)
 * @param riskToFloorPct      % move from price down to the green line (negative when below it)
 * @param upsideToCeilingPct  % move from price up to the red line
 * @param signal              zone classification
 */
public record TradingZone(
    @JsonProperty("maxBuyPrice")        Double maxBuyPrice,
    @JsonProperty("startSellPrice")     Double startSellPrice,
    @JsonProperty("riskToFloorPct")     Double riskToFloorPct,
    @JsonProperty("upsideToCeilingPct") Double upsideToCeilingPct,
    @JsonProperty("signal")             ZoneSignal signal
) {
    public static TradingZone noData() {
        return new TradingZone(null, null, null, null, null);
    }

    public boolean hasData() {
        return signal != null;
    }
}

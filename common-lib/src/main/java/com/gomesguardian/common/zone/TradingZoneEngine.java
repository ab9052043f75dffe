package com.gomesguardian.common.zone;

import com.gomesguardian.common.model.PriceLines;
import com.gomesguardian.common.model.TradingZone;
import com.gomesguardian.common.model.ZoneSignal;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts analyst price lines into a trading-zone signal.
 *
 * <h3>Zones</h3>
 * <pre>
 *   buy ceiling = green × {@value #BUY_CEILING_FACTOR}
 *   sell floor  = red   × {@value #SELL_FLOOR_FACTOR}
 *
 *   price &lt; green                    → AGGRESSIVE_BUY
 *   green ≤ price ≤ buy ceiling       → BUY
 *   price &gt; red                      → STRONG_SELL
 *   sell floor ≤ price ≤ red          → SELL
 *   otherwise                         → HOLD
 *
 *   risk%   = (price − green) / price × 100
 *   upside% = (red − price)   / price × 100
 * </pre>
 *
 * <p>Rules are checked in the order above; when the two tolerance bands overlap
 * the buy side wins. Prices and percentages are rounded half-up to two decimals,
 * the signal is classified on unrounded values.
 *
 * <p>Stateless, pure, and thread-safe.
 */
public final class TradingZoneEngine {

    /** Tolerance above the green line still counted as a buy. */
    public static final double BUY_CEILING_FACTOR = 1.05;

    /** Tolerance below the red line already counted as a sell. */
    public static final double SELL_FLOOR_FACTOR = 0.95;

    private TradingZoneEngine() {}

    /**
     * Computes the zone for a price against green/red lines.
     *
     * @return the zone; {@link TradingZone#noData()} when any input is absent or
     *         not finite, the price is not positive, the lines are inverted, or a
     *         percentage overflows. Never null.
     */
    public static TradingZone computeZone(Double price, Double green, Double red) {
        if (price == null || green == null || red == null) {
            return TradingZone.noData();
        }
        if (!Double.isFinite(price) || !Double.isFinite(green) || !Double.isFinite(red)) {
            return TradingZone.noData();
        }
        if (!(price > 0) || !(green > 0) || green >= red) {
            return TradingZone.noData();
        }

        double maxBuy    = green * BUY_CEILING_FACTOR;
        double startSell = red * SELL_FLOOR_FACTOR;
        double riskPct   = (price - green) / price * 100.0;
        double upsidePct = (red - price) / price * 100.0;
        if (!Double.isFinite(maxBuy) || !Double.isFinite(startSell)
                || !Double.isFinite(riskPct) || !Double.isFinite(upsidePct)) {
            return TradingZone.noData();
        }

        return new TradingZone(
            round2(maxBuy),
            round2(startSell),
            round2(riskPct),
            round2(upsidePct),
            classify(price, green, red, maxBuy, startSell));
    }

    /** Convenience overload for validated lines. */
    public static TradingZone computeZone(Double price, PriceLines lines) {
        if (lines == null) {
            return TradingZone.noData();
        }
        return computeZone(price, lines.greenLine(), lines.redLine());
    }

    /** True when {@code price} sits at or below the green line; false when either is unknown. */
    public static boolean isAtOrBelowGreen(Double price, Double green) {
        return price != null && green != null && price <= green;
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static ZoneSignal classify(double price, double green, double red,
                                       double maxBuy, double startSell) {
        if (price < green)                      return ZoneSignal.AGGRESSIVE_BUY;
        if (price <= maxBuy)                    return ZoneSignal.BUY;
        if (price > red)                        return ZoneSignal.STRONG_SELL;
        if (price >= startSell)                 return ZoneSignal.SELL;
        return ZoneSignal.HOLD;
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

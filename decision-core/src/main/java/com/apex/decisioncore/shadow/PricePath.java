package com.apex.decisioncore.shadow;

/**
 * Aggregated price action over a window: extremes and last close only, no tick order.
 */
public record PricePath(double high, double low, double close, int bars) {

    public boolean usable() {
        return bars > 0 && Double.isFinite(high) && Double.isFinite(low) && Double.isFinite(close)
                && close > 0 && high >= low;
    }
}

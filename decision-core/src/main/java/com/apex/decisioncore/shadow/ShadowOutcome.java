package com.apex.decisioncore.shadow;

import java.time.Instant;

/**
 * One scored variant of one horizon. {@code tpPct} and {@code slPct} are null for the baseline.
 */
public record ShadowOutcome(
        String intentId,
        String symbol,
        ShadowKind kind,
        int horizonMin,
        double entryPrice,
        double endPrice,
        double returnPct,
        String variant,
        Double tpPct,
        Double slPct,
        boolean hitTp,
        boolean hitSl,
        boolean ambiguous,
        double high,
        double low,
        Instant evaluatedAt
) {
    public static final String BASELINE_VARIANT = "end";

    public boolean baseline() {
        return BASELINE_VARIANT.equals(variant);
    }
}

package com.apex.decisioncore.learning;

import java.time.Instant;
import java.util.Map;

/**
 * Result of a closed position, fed back by the execution side.
 *
 * @param components score components recorded when the position was entered
 */
public record RealizedTradeOutcome(
        String symbol,
        String direction,
        double pnl,
        double pnlPct,
        String closeReason,
        Map<String, Double> components,
        Instant closedAt
) {
    public RealizedTradeOutcome {
        components = components == null ? Map.of() : Map.copyOf(components);
    }
}

package com.apex.decisioncore.trading.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * One open position as reported by the execution side.
 *
 * @param currentScore latest composite score of the held symbol, used to find the weakest incumbent
 */
public record HeldPosition(
        String symbol,
        Instant entryTime,
        double quantity,
        Direction direction,
        double currentScore,
        String sector
) {
    public Duration heldFor(Instant now) {
        if (entryTime == null || now.isBefore(entryTime)) {
            return Duration.ZERO;
        }
        return Duration.between(entryTime, now);
    }
}

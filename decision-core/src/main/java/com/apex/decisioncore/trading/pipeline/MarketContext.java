package com.apex.decisioncore.trading.pipeline;

/**
 * Market-wide context of one cycle.
 *
 * @param posture the direction the current regime favours; {@link Direction#NEUTRAL} when it has no view
 */
public record MarketContext(String regimeLabel, Direction posture, boolean highVolatility) {

    public static MarketContext neutral() {
        return new MarketContext("neutral", Direction.NEUTRAL, false);
    }
}

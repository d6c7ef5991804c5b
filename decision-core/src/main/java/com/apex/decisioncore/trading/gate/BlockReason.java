package com.apex.decisioncore.trading.gate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of reasons a candidate can be blocked with. The lower-case name is the wire code.
 */
public enum BlockReason {
    CAPACITY_FULL,
    DISPLACEMENT_MIN_HOLD,
    DISPLACEMENT_NO_DOMINANCE,
    DISPLACEMENT_BLOCKED,
    DISPLACEMENT_FAILED,
    DIRECTIONAL_CONFLICT,
    BLOCKED_HIGH_VOL_NO_ALIGNMENT,
    RISK_EXCEEDED,
    SYMBOL_EXPOSURE_LIMIT,
    SECTOR_EXPOSURE_LIMIT,
    SCORE_BELOW_MIN,
    MAX_POSITIONS_REACHED,
    SYMBOL_ON_COOLDOWN,
    MOMENTUM_IGNITION_FILTER,
    MARKET_CLOSED,
    LONG_ONLY_BLOCKED_SHORT_ENTRY,
    REGIME_BLOCKED,
    CONCENTRATION_GATE,
    THEME_EXPOSURE_BLOCKED,
    OTHER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.apex.decisioncore.trading.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Direction {
    BULLISH,
    BEARISH,
    NEUTRAL;

    public static Direction ofScore(double score) {
        if (score > 0) {
            return BULLISH;
        }
        if (score < 0) {
            return BEARISH;
        }
        return NEUTRAL;
    }

    public double sign() {
        return switch (this) {
            case BULLISH -> 1.0;
            case BEARISH -> -1.0;
            case NEUTRAL -> 0.0;
        };
    }

    @JsonCreator
    public static Direction parse(String value) {
        if (value == null) {
            return NEUTRAL;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("bull") || v.equals("long") || v.equals("buy")) {
            return BULLISH;
        }
        if (v.startsWith("bear") || v.equals("short") || v.equals("sell")) {
            return BEARISH;
        }
        return NEUTRAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.apex.decisioncore.trading.trace;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DecisionOutcome {
    ENTERED,
    BLOCKED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

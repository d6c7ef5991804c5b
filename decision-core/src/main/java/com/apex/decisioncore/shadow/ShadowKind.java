package com.apex.decisioncore.shadow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ShadowKind {
    BLOCKED,
    TAKEN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

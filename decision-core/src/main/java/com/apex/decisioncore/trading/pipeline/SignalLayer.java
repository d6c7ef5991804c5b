package com.apex.decisioncore.trading.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalLayer {
    FLOW("flow_signals"),
    DARK_POOL("dark_pool_signals"),
    REGIME("regime_signals"),
    VOLATILITY("volatility_signals"),
    OTHER("other_signals");

    private final String traceKey;

    SignalLayer(String traceKey) {
        this.traceKey = traceKey;
    }

    @JsonValue
    public String traceKey() {
        return traceKey;
    }
}

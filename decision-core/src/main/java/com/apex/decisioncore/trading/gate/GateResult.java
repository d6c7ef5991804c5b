package com.apex.decisioncore.trading.gate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verdict of one gate stage. {@code reason} is null exactly when the stage passed.
 */
public record GateResult(String gate, boolean passed, BlockReason reason, Map<String, Object> details) {

    public GateResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static GateResult pass(String gate, Map<String, Object> details) {
        return new GateResult(gate, true, null, details);
    }

    public static GateResult block(String gate, BlockReason reason, Map<String, Object> details) {
        return new GateResult(gate, false, reason, details);
    }

    public String reasonCode() {
        return reason == null ? null : reason.code();
    }
}

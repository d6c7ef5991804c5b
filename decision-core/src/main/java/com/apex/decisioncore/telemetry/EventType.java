package com.apex.decisioncore.telemetry;

import java.util.List;

/**
 * Record kinds written to the append-only logs. Each kind names the file it lands in and the fields a
 * record must carry; {@link JsonlEventWriter} rejects records missing any of them.
 */
public enum EventType {
    DECISION_TRACE("decision_traces.jsonl",
            List.of("intent_id", "symbol", "signal_layers", "aggregation", "gates", "final_decision")),
    BLOCKED_TRADE("blocked_trades.jsonl",
            List.of("timestamp", "symbol", "reason", "score", "direction")),
    SHADOW_INTENT("shadow_outcomes.jsonl",
            List.of("intent_id", "symbol", "entry_ts", "entry_price", "direction", "kind", "horizons")),
    SHADOW_OUTCOME("shadow_outcomes.jsonl",
            List.of("intent_id", "horizon_min", "entry_price", "end_price", "return_pct", "variant",
                    "hit_tp", "hit_sl", "ambiguous")),
    SHADOW_ARCHIVED("shadow_outcomes.jsonl",
            List.of("intent_id", "symbol")),
    WEIGHT_UPDATE("weight_learning.jsonl",
            List.of("version", "adjustments")),
    HEALTH_CHECK("health_checks.jsonl",
            List.of("name", "severity", "status", "consecutive_failures"));

    public static final int SCHEMA_VERSION = 1;

    private final String fileName;
    private final List<String> requiredFields;

    EventType(String fileName, List<String> requiredFields) {
        this.fileName = fileName;
        this.requiredFields = requiredFields;
    }

    public String fileName() {
        return fileName;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }
}

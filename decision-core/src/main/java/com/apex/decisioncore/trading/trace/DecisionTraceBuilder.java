package com.apex.decisioncore.trading.trace;

import com.apex.decisioncore.telemetry.EventType;
import com.apex.decisioncore.trading.gate.GateResult;
import com.apex.decisioncore.trading.pipeline.FeatureContribution;
import com.apex.decisioncore.trading.pipeline.SignalLayer;
import com.apex.decisioncore.trading.pipeline.SignalScore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable draft of a trace. Gates are appended in order and can never be replaced. After
 * {@link #finalizeDecision} every mutator throws.
 */
public class DecisionTraceBuilder {

    private final String intentId;
    private final String cycleId;
    private final String symbol;
    private final Instant timestamp;
    private final SignalScore score;
    private final Map<String, GateOutcome> gates = new LinkedHashMap<>();
    private final List<String> secondaryReasons = new ArrayList<>();
    private boolean finalized;

    DecisionTraceBuilder(String intentId, String cycleId, String symbol, Instant timestamp, SignalScore score) {
        this.intentId = intentId;
        this.cycleId = cycleId;
        this.symbol = symbol;
        this.timestamp = timestamp;
        this.score = score;
        score.coercedInputs().forEach(name -> secondaryReasons.add("input_coerced:" + name));
        if (score.emptyInput()) {
            secondaryReasons.add("empty_input");
        }
    }

    public String intentId() {
        return intentId;
    }

    public synchronized DecisionTraceBuilder addGate(GateResult result) {
        ensureOpen();
        if (gates.containsKey(result.gate())) {
            throw new IllegalStateException("Gate " + result.gate() + " already recorded for " + intentId);
        }
        gates.put(result.gate(), new GateOutcome(result.passed(), result.reasonCode(), result.details()));
        return this;
    }

    public synchronized DecisionTraceBuilder addSecondaryReason(String reason) {
        ensureOpen();
        if (reason != null && !reason.isBlank() && !secondaryReasons.contains(reason)) {
            secondaryReasons.add(reason);
        }
        return this;
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    /**
     * Closes the draft and returns the finished, not yet validated trace.
     */
    public synchronized DecisionIntelligenceTrace finalizeDecision(DecisionOutcome outcome, String primaryReason) {
        ensureOpen();
        finalized = true;
        Map<String, List<FeatureContribution>> layers = new LinkedHashMap<>();
        for (SignalLayer layer : SignalLayer.values()) {
            layers.put(layer.traceKey(), score.layers().getOrDefault(layer, List.of()));
        }
        AggregationSummary aggregation = new AggregationSummary(score.rawScore(), score.normalizedScore(),
                score.directionConfidence(), score.scoreComponents(), score.unmappedComponents(),
                score.weightVersion());
        return new DecisionIntelligenceTrace(EventType.SCHEMA_VERSION, intentId, cycleId, symbol, score.direction(),
                timestamp, layers, score.opposingSignals(), aggregation, gates,
                new FinalDecision(outcome, primaryReason, secondaryReasons), score.coercedInputs(),
                score.emptyInput(), true, List.of());
    }

    private void ensureOpen() {
        if (finalized) {
            throw new IllegalStateException("Trace " + intentId + " is finalized");
        }
    }
}

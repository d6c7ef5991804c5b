package com.apex.decisioncore.trading.trace;

import com.apex.decisioncore.trading.pipeline.Direction;
import com.apex.decisioncore.trading.pipeline.FeatureContribution;
import com.apex.decisioncore.trading.pipeline.OpposingSignal;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full explanation of one decision for one symbol in one cycle. Instances only exist in finalised form;
 * they are produced by {@link DecisionTraceBuilder#finalizeDecision} and never change afterwards.
 *
 * @param signalLayers layer key (e.g. {@code flow_signals}) to the contributions classified into it
 * @param gates        gate name to verdict, in evaluation order
 */
public record DecisionIntelligenceTrace(
        int schemaVersion,
        String intentId,
        String cycleId,
        String symbol,
        Direction side,
        Instant timestamp,
        Map<String, List<FeatureContribution>> signalLayers,
        List<OpposingSignal> opposingSignals,
        AggregationSummary aggregation,
        Map<String, GateOutcome> gates,
        FinalDecision finalDecision,
        List<String> coercedInputs,
        boolean emptyInput,
        boolean valid,
        List<String> validationErrors
) {

    public DecisionIntelligenceTrace {
        signalLayers = Collections.unmodifiableMap(new LinkedHashMap<>(signalLayers));
        opposingSignals = List.copyOf(opposingSignals);
        gates = Collections.unmodifiableMap(new LinkedHashMap<>(gates));
        coercedInputs = List.copyOf(coercedInputs);
        validationErrors = List.copyOf(validationErrors);
    }

    @JsonIgnore
    public long populatedLayerCount() {
        return signalLayers.values().stream().filter(list -> !list.isEmpty()).count();
    }

    @JsonIgnore
    public boolean blocked() {
        return finalDecision != null && finalDecision.outcome() == DecisionOutcome.BLOCKED;
    }

    DecisionIntelligenceTrace withValidation(List<String> errors) {
        return new DecisionIntelligenceTrace(schemaVersion, intentId, cycleId, symbol, side, timestamp,
                signalLayers, opposingSignals, aggregation, gates, finalDecision, coercedInputs, emptyInput,
                errors.isEmpty(), errors);
    }
}

package com.apex.decisioncore.trading.trace;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.exception.TraceValidationException;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.telemetry.EventType;
import com.apex.decisioncore.telemetry.JsonlEventWriter;
import com.apex.decisioncore.trading.pipeline.SignalScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds, validates and emits decision traces. Validation never changes the decision: a trace that
 * breaks an invariant is still written, flagged {@code valid=false}, and reported as an operational error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DecisionTracer {

    static final int MIN_POPULATED_LAYERS = 2;

    private final JsonlEventWriter eventWriter;
    private final DecisionProperties decisionProperties;
    private final MetricsService metricsService;

    public DecisionTraceBuilder begin(String intentId, String cycleId, String symbol, Instant timestamp,
                                      SignalScore score) {
        return new DecisionTraceBuilder(intentId, cycleId, symbol, timestamp, score);
    }

    public DecisionIntelligenceTrace finalizeTrace(DecisionTraceBuilder builder, DecisionOutcome outcome,
                                                   String primaryReason) {
        DecisionIntelligenceTrace draft = builder.finalizeDecision(outcome, primaryReason);
        List<String> violations = validate(draft);
        if (violations.isEmpty()) {
            return draft;
        }
        DecisionIntelligenceTrace invalid = draft.withValidation(violations);
        metricsService.recordInvalidTrace();
        log.error("Invalid decision trace symbol={} outcome={}",
                draft.symbol(), outcome, new TraceValidationException(draft.intentId(), violations));
        return invalid;
    }

    public List<String> validate(DecisionIntelligenceTrace trace) {
        List<String> violations = new ArrayList<>();
        long populated = trace.populatedLayerCount();
        if (populated < MIN_POPULATED_LAYERS) {
            violations.add("signal_layers has " + populated + " non-empty layers, need at least "
                    + MIN_POPULATED_LAYERS);
        }
        FinalDecision decision = trace.finalDecision();
        if (decision == null || decision.outcome() == null) {
            violations.add("final_decision.outcome missing");
        } else if (decision.outcome() == DecisionOutcome.BLOCKED
                && (decision.primaryReason() == null || decision.primaryReason().isBlank())) {
            violations.add("blocked decision without primary_reason");
        }
        int size = eventWriter.serializedSize(trace);
        int cap = decisionProperties.getTrace().getMaxSerializedBytes();
        if (size > cap) {
            violations.add("serialized size " + size + " bytes exceeds cap of " + cap);
        }
        return violations;
    }

    /**
     * Writes the finalised trace and, for blocked decisions, the blocked-trade record. Failures are
     * logged and swallowed here so that an emission problem cannot undo a decision already taken.
     */
    public void emit(DecisionIntelligenceTrace trace) {
        try {
            eventWriter.append(EventType.DECISION_TRACE, trace);
            if (trace.blocked()) {
                eventWriter.append(EventType.BLOCKED_TRADE, new BlockedTradeRecord(trace.timestamp(),
                        trace.intentId(), trace.symbol(), trace.finalDecision().primaryReason(),
                        trace.aggregation().normalizedScore(), trace.side()));
            }
        } catch (RuntimeException e) {
            log.error("Failed to emit decision trace {} for {}", trace.intentId(), trace.symbol(), e);
        }
    }
}

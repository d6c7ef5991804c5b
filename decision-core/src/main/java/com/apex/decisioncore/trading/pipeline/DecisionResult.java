package com.apex.decisioncore.trading.pipeline;

import com.apex.decisioncore.trading.trace.DecisionIntelligenceTrace;
import com.apex.decisioncore.trading.trace.DecisionOutcome;

import java.util.List;

/**
 * @param displacedSymbol incumbent to evict before entering, or null when no displacement is involved
 */
public record DecisionResult(
        String symbol,
        String intentId,
        DecisionOutcome outcome,
        String primaryReason,
        List<String> secondaryReasons,
        String displacedSymbol,
        SignalScore signalScore,
        DecisionIntelligenceTrace trace
) {
    public boolean entered() {
        return outcome == DecisionOutcome.ENTERED;
    }
}

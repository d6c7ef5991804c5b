package com.apex.decisioncore.trading.trace;

import java.util.List;

public record FinalDecision(DecisionOutcome outcome, String primaryReason, List<String> secondaryReasons) {
    public FinalDecision {
        secondaryReasons = secondaryReasons == null ? List.of() : List.copyOf(secondaryReasons);
    }
}

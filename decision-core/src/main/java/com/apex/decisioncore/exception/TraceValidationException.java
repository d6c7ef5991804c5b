package com.apex.decisioncore.exception;

import java.util.List;

/**
 * Raised when a finalised decision trace breaks one of its structural invariants. The decision itself
 * stands; only the explanation is flagged invalid.
 */
public class TraceValidationException extends TradingException {
    private final String intentId;
    private final List<String> violations;

    public TraceValidationException(String intentId, List<String> violations) {
        super("Decision trace " + intentId + " failed validation: " + String.join("; ", violations));
        this.intentId = intentId;
        this.violations = List.copyOf(violations);
    }

    public String getIntentId() {
        return intentId;
    }

    public List<String> getViolations() {
        return violations;
    }
}

package com.apex.decisioncore.learning;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param skipped component name to the reason it was left untouched
 */
public record LearningCycleResult(
        long version,
        Instant ranAt,
        List<WeightAdjustment> adjustments,
        Map<String, String> skipped
) {
    public boolean adjusted() {
        return !adjustments.isEmpty();
    }
}

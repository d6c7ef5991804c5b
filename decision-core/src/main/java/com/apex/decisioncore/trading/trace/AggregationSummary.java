package com.apex.decisioncore.trading.trace;

import java.util.List;
import java.util.Map;

public record AggregationSummary(
        double rawScore,
        double normalizedScore,
        double directionConfidence,
        Map<String, Double> scoreComponents,
        List<String> unmappedComponents,
        long weightVersion
) {}

package com.apex.decisioncore.trading.pipeline;

public record FeatureContribution(
        String feature,
        String rawName,
        SignalLayer layer,
        double value,
        double weight,
        double contribution,
        boolean coerced,
        boolean unmapped,
        boolean redistributed
) {
    public FeatureContribution movedTo(SignalLayer target) {
        return new FeatureContribution(feature, rawName, target, value, weight, contribution, coerced, unmapped, true);
    }
}

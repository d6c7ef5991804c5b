package com.apex.decisioncore.trading.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SignalScore(
        double rawScore,
        double normalizedScore,
        Direction direction,
        double directionConfidence,
        List<FeatureContribution> contributions,
        Map<SignalLayer, List<FeatureContribution>> layers,
        List<OpposingSignal> opposingSignals,
        List<String> coercedInputs,
        List<String> unmappedComponents,
        boolean emptyInput,
        long weightVersion
) {

    public SignalScore {
        contributions = List.copyOf(contributions);
        layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
        opposingSignals = List.copyOf(opposingSignals);
        coercedInputs = List.copyOf(coercedInputs);
        unmappedComponents = List.copyOf(unmappedComponents);
    }

    public double strength() {
        return Math.abs(normalizedScore);
    }

    /**
     * Weighted contribution per canonical component, in input order.
     */
    public Map<String, Double> scoreComponents() {
        Map<String, Double> components = new LinkedHashMap<>();
        for (FeatureContribution contribution : contributions) {
            components.merge(contribution.feature(), contribution.contribution(), Double::sum);
        }
        return components;
    }

    /**
     * Unweighted values per canonical component, used to attribute later outcomes back to signals.
     */
    public Map<String, Double> componentValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (FeatureContribution contribution : contributions) {
            values.merge(contribution.feature(), contribution.value(), Double::sum);
        }
        return values;
    }

    public long populatedLayerCount() {
        return layers.values().stream().filter(list -> !list.isEmpty()).count();
    }
}

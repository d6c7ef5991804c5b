package com.apex.decisioncore.trading.pipeline;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.learning.WeightSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultSignalAggregator implements SignalAggregator {

    private static final String UNNAMED = "unnamed";

    private final DecisionProperties decisionProperties;

    @Override
    public SignalScore aggregate(List<SignalComponent> components, WeightSnapshot weights) {
        WeightSnapshot snapshot = weights != null ? weights : WeightSnapshot.empty();
        if (components == null || components.isEmpty()) {
            return new SignalScore(0.0, 0.0, Direction.NEUTRAL, 0.5, List.of(), emptyLayers(),
                    List.of(), List.of(), List.of(), true, snapshot.version());
        }

        List<FeatureContribution> contributions = new ArrayList<>();
        List<String> coercedInputs = new ArrayList<>();
        List<String> unmapped = new ArrayList<>();
        for (SignalComponent component : components) {
            String rawName = component.name() == null || component.name().isBlank() ? UNNAMED : component.name();
            Optional<CanonicalComponent> canonical = CanonicalComponent.resolve(rawName);
            String feature = canonical.map(CanonicalComponent::canonicalName)
                    .orElse(CanonicalComponent.normalize(rawName));
            SignalLayer layer = canonical.map(CanonicalComponent::layer)
                    .orElseGet(() -> hintedLayer(component.sourceLayer())
                            .orElse(CanonicalComponent.guessLayer(rawName)));
            if (canonical.isEmpty()) {
                unmapped.add(feature);
            }

            Double parsed = coerce(component.value());
            boolean coerced = parsed == null;
            double value = coerced ? 0.0 : parsed;
            if (coerced) {
                coercedInputs.add(rawName);
                log.debug("Coerced malformed component {}={} to 0.0", rawName, component.value());
            }
            double weight = snapshot.weightFor(feature);
            contributions.add(new FeatureContribution(feature, rawName, layer, value, weight, value * weight,
                    coerced, canonical.isEmpty(), false));
        }

        redistributeIfSingleLayer(contributions);

        double rawScore = contributions.stream().mapToDouble(FeatureContribution::contribution).sum();
        double cap = decisionProperties.getAggregator().getNormalizationCap();
        double normalizedScore = cap * Math.tanh(rawScore / cap);
        Direction direction = Direction.ofScore(rawScore);

        Map<SignalLayer, List<FeatureContribution>> layers = emptyLayers();
        for (FeatureContribution contribution : contributions) {
            layers.get(contribution.layer()).add(contribution);
        }

        List<OpposingSignal> opposing = new ArrayList<>();
        double aligned = 0.0;
        double total = 0.0;
        for (FeatureContribution contribution : contributions) {
            double magnitude = Math.abs(contribution.contribution());
            total += magnitude;
            double signed = contribution.contribution() * direction.sign();
            if (signed > 0) {
                aligned += magnitude;
            } else if (signed < 0) {
                opposing.add(new OpposingSignal(contribution.feature(), contribution.layer().traceKey(),
                        contribution.contribution(), magnitude));
            }
        }
        double directionConfidence = total == 0.0 || direction == Direction.NEUTRAL ? 0.5 : aligned / total;

        return new SignalScore(rawScore, normalizedScore, direction, directionConfidence, contributions, layers,
                opposing, coercedInputs, unmapped, false, snapshot.version());
    }

    /**
     * Keeps the explanation multi-layered: when every contribution landed in one layer, the weakest one
     * is moved into the default layer. Impossible when that one layer already is the default.
     */
    private void redistributeIfSingleLayer(List<FeatureContribution> contributions) {
        if (contributions.size() < 2) {
            return;
        }
        SignalLayer only = contributions.get(0).layer();
        for (FeatureContribution contribution : contributions) {
            if (contribution.layer() != only) {
                return;
            }
        }
        SignalLayer target = decisionProperties.getAggregator().getDefaultLayer();
        if (only == target) {
            log.debug("All {} components are in default layer {}, cannot redistribute", contributions.size(), target);
            return;
        }
        int weakest = 0;
        for (int i = 1; i < contributions.size(); i++) {
            if (Math.abs(contributions.get(i).contribution()) < Math.abs(contributions.get(weakest).contribution())) {
                weakest = i;
            }
        }
        contributions.set(weakest, contributions.get(weakest).movedTo(target));
    }

    private Map<SignalLayer, List<FeatureContribution>> emptyLayers() {
        Map<SignalLayer, List<FeatureContribution>> layers = new EnumMap<>(SignalLayer.class);
        for (SignalLayer layer : SignalLayer.values()) {
            layers.put(layer, new ArrayList<>());
        }
        return layers;
    }

    private Optional<SignalLayer> hintedLayer(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = CanonicalComponent.normalize(hint);
        for (SignalLayer layer : SignalLayer.values()) {
            if (layer.name().equalsIgnoreCase(normalized) || layer.traceKey().equals(normalized)) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    /**
     * Numeric view of a raw component value, or {@code null} when it cannot be read as a finite number.
     */
    static Double coerce(Object raw) {
        if (raw instanceof Number number) {
            double v = number.doubleValue();
            return Double.isFinite(v) ? v : null;
        }
        if (raw instanceof String text) {
            try {
                double v = Double.parseDouble(text.trim());
                return Double.isFinite(v) ? v : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (raw instanceof Map<?, ?> nested) {
            Object inner = nested.containsKey("value") ? nested.get("value") : nested.get("score");
            if (inner instanceof Map<?, ?>) {
                return null;
            }
            return inner == null ? null : coerce(inner);
        }
        return null;
    }
}

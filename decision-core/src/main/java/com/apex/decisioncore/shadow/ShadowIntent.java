package com.apex.decisioncore.shadow;

import com.apex.decisioncore.trading.pipeline.Direction;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * A hypothetical position followed only for counterfactual scoring.
 *
 * @param horizons  minutes after entry at which the intent is scored, ascending
 * @param evaluated horizons already scored
 */
public record ShadowIntent(
        String intentId,
        String symbol,
        Instant entryTs,
        double entryPrice,
        Direction direction,
        ShadowKind kind,
        List<Integer> horizons,
        List<Integer> evaluated,
        double score,
        String reason,
        Map<String, Double> components
) {

    public ShadowIntent {
        horizons = List.copyOf(new TreeSet<>(horizons));
        evaluated = evaluated == null ? List.of() : List.copyOf(new TreeSet<>(evaluated));
        components = components == null ? Map.of() : Map.copyOf(components);
    }

    public static String idFor(String symbol, ShadowKind kind, Instant entryTs) {
        return "intent-" + symbol + "-" + kind.label() + "-" + entryTs.getEpochSecond();
    }

    public boolean isEvaluated(int horizonMin) {
        return evaluated.contains(horizonMin);
    }

    public boolean complete() {
        return evaluated.containsAll(horizons);
    }

    public Instant dueAt(int horizonMin) {
        return entryTs.plus(Duration.ofMinutes(horizonMin));
    }

    /**
     * Earliest horizon not yet scored whose window has closed by {@code now}.
     */
    public Optional<Integer> nextDue(Instant now) {
        for (Integer horizon : horizons) {
            if (!isEvaluated(horizon)) {
                return dueAt(horizon).isAfter(now) ? Optional.empty() : Optional.of(horizon);
            }
        }
        return Optional.empty();
    }

    ShadowIntent withEvaluated(int horizonMin) {
        TreeSet<Integer> done = new TreeSet<>(evaluated);
        done.add(horizonMin);
        return new ShadowIntent(intentId, symbol, entryTs, entryPrice, direction, kind, horizons,
                List.copyOf(done), score, reason, components);
    }
}

package com.apex.decisioncore.learning;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, versioned view of every weight band. Readers hold a snapshot for the whole cycle.
 */
public record WeightSnapshot(long version, Map<String, WeightBand> bands, Instant updatedAt) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public WeightSnapshot {
        bands = bands == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(bands));
    }

    public static WeightSnapshot empty() {
        return new WeightSnapshot(0L, Map.of(), null);
    }

    public double weightFor(String component) {
        WeightBand band = bands.get(component);
        return band == null ? DEFAULT_WEIGHT : band.currentWeight();
    }

    public Optional<WeightBand> band(String component) {
        return Optional.ofNullable(bands.get(component));
    }
}

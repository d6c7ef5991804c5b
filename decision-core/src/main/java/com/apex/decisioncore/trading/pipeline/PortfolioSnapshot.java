package com.apex.decisioncore.trading.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Held positions as of one instant. Taken once per decision cycle and shared by every gate in it.
 */
public record PortfolioSnapshot(Map<String, HeldPosition> positions, Instant capturedAt) {

    public PortfolioSnapshot {
        positions = positions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    public static PortfolioSnapshot empty(Instant capturedAt) {
        return new PortfolioSnapshot(Map.of(), capturedAt);
    }

    public int size() {
        return positions.size();
    }

    public boolean holds(String symbol) {
        return positions.containsKey(symbol);
    }

    public long countInSector(String sector) {
        if (sector == null) {
            return 0;
        }
        return positions.values().stream()
                .filter(position -> Objects.equals(sector, position.sector()))
                .count();
    }

    /**
     * Position with the lowest absolute current score; ties go to the oldest entry.
     */
    public Optional<HeldPosition> weakest() {
        return positions.values().stream()
                .min(Comparator.comparingDouble((HeldPosition p) -> Math.abs(p.currentScore()))
                        .thenComparing(HeldPosition::entryTime, Comparator.nullsLast(Comparator.naturalOrder())));
    }
}

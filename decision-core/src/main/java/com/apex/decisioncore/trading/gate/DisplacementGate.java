package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.trading.pipeline.HeldPosition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a candidate may evict the weakest held position when the book is full. The incumbent
 * must have been held at least {@code minHold}; only then is the score advantage looked at.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DisplacementGate implements Gate {

    public static final String NAME = "displacement_gate";

    private static final Duration BUDGET_WINDOW = Duration.ofHours(1);

    private final DecisionProperties decisionProperties;

    private final Deque<Instant> recentDisplacements = new ArrayDeque<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (!context.isDisplacementRequired()) {
            details.put("evaluated", false);
            return GateResult.pass(NAME, details);
        }
        details.put("evaluated", true);
        DecisionProperties.Displacement config = decisionProperties.getGates().getDisplacement();

        Optional<HeldPosition> weakest = context.getPortfolio().weakest();
        if (weakest.isEmpty() || weakest.get().entryTime() == null) {
            details.put("error", weakest.isEmpty() ? "no_incumbent" : "incumbent_entry_time_unknown");
            return GateResult.block(NAME, BlockReason.DISPLACEMENT_FAILED, details);
        }
        HeldPosition incumbent = weakest.get();
        double candidateScore = context.getScore().strength();
        double incumbentScore = Math.abs(incumbent.currentScore());
        double delta = candidateScore - incumbentScore;
        Duration held = incumbent.heldFor(context.getNow());
        long remaining = Math.max(0, config.getMinHold().minus(held).getSeconds());

        details.put("incumbent_symbol", incumbent.symbol());
        details.put("incumbent_score", incumbentScore);
        details.put("challenger_score", candidateScore);
        details.put("challenger_delta", delta);
        details.put("min_delta_score", config.getMinDeltaScore());
        details.put("incumbent_held_sec", held.getSeconds());
        details.put("min_hold_remaining_sec", remaining);

        int used = displacementsWithinWindow(context.getNow());
        details.put("displacements_last_hour", used);
        if (held.compareTo(config.getMinHold()) < 0) {
            return GateResult.block(NAME, BlockReason.DISPLACEMENT_MIN_HOLD, details);
        }
        if (config.getMaxPerHour() > 0 && used >= config.getMaxPerHour()) {
            return GateResult.block(NAME, BlockReason.DISPLACEMENT_BLOCKED, details);
        }
        if (delta < config.getMinDeltaScore()) {
            return GateResult.block(NAME, BlockReason.DISPLACEMENT_NO_DOMINANCE, details);
        }
        context.displace(incumbent.symbol());
        return GateResult.pass(NAME, details);
    }

    /**
     * Counts an executed displacement against the rolling hourly budget.
     */
    public synchronized void recordDisplacement(Instant at) {
        recentDisplacements.addLast(at);
        log.info("Displacement recorded at {}, {} in the last hour", at, displacementsWithinWindow(at));
    }

    synchronized int displacementsWithinWindow(Instant now) {
        Instant cutoff = now.minus(BUDGET_WINDOW);
        while (!recentDisplacements.isEmpty() && recentDisplacements.peekFirst().isBefore(cutoff)) {
            recentDisplacements.pollFirst();
        }
        return recentDisplacements.size();
    }
}

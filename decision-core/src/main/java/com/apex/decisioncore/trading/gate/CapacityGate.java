package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.config.DecisionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks free slots. A full book with displacement enabled is not a block here: the candidate moves on
 * and the displacement stage decides whether it may evict an incumbent.
 */
@Component
@RequiredArgsConstructor
public class CapacityGate implements Gate {

    public static final String NAME = "capacity_gate";

    private final DecisionProperties decisionProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        DecisionProperties.Capacity capacity = decisionProperties.getGates().getCapacity();
        int held = context.getPortfolio().size();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("positions", held);
        details.put("max_positions", capacity.getMaxPositions());
        if (held < capacity.getMaxPositions()) {
            details.put("displacement_required", false);
            return GateResult.pass(NAME, details);
        }
        if (!capacity.isDisplacementEnabled()) {
            return GateResult.block(NAME, BlockReason.CAPACITY_FULL, details);
        }
        context.requireDisplacement();
        details.put("displacement_required", true);
        return GateResult.pass(NAME, details);
    }
}

package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.trading.trace.DecisionTraceBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the stages in their fixed order and stops at the first block. Every evaluated stage is appended
 * to the trace; stages after a block are never run.
 */
@Service
@Slf4j
public class GatePipeline {

    private final List<Gate> stages;

    @Autowired
    public GatePipeline(ScoreGate scoreGate, CapacityGate capacityGate, RiskGate riskGate,
                        DisplacementGate displacementGate, DirectionalGate directionalGate) {
        this(List.of(scoreGate, capacityGate, riskGate, displacementGate, directionalGate));
    }

    GatePipeline(List<Gate> stages) {
        this.stages = List.copyOf(stages);
    }

    public record Verdict(boolean passed, BlockReason reason, String blockingGate, String displacedSymbol,
                          List<GateResult> results) {
        public String primaryReason() {
            return passed ? "all_gates_passed" : reason.code();
        }
    }

    public Verdict run(GateContext context, DecisionTraceBuilder trace) {
        List<GateResult> results = new ArrayList<>();
        for (Gate stage : stages) {
            GateResult result = evaluateSafely(stage, context);
            results.add(result);
            trace.addGate(result);
            if (!result.passed()) {
                log.debug("{} blocked {} reason={}", stage.name(), context.symbol(), result.reasonCode());
                return new Verdict(false, result.reason(), stage.name(), null, results);
            }
        }
        return new Verdict(true, null, null, context.getDisplacedSymbol(), results);
    }

    public List<String> stageNames() {
        return stages.stream().map(Gate::name).toList();
    }

    private GateResult evaluateSafely(Gate stage, GateContext context) {
        try {
            GateResult result = stage.evaluate(context);
            if (result == null) {
                return errorResult(stage, "stage returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Gate {} failed for {}, blocking", stage.name(), context.symbol(), e);
            return errorResult(stage, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private GateResult errorResult(Gate stage, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", error);
        return GateResult.block(stage.name(), BlockReason.OTHER, details);
    }
}

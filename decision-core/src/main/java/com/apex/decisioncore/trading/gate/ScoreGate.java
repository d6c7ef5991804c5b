package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.trading.pipeline.SignalScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ScoreGate implements Gate {

    public static final String NAME = "score_gate";

    private final DecisionProperties decisionProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        SignalScore score = context.getScore();
        double minScore = decisionProperties.getGates().getScore().getMinScore();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("score", score.normalizedScore());
        details.put("min_score", minScore);
        if (score.emptyInput()) {
            details.put("empty_input", true);
            return GateResult.block(NAME, BlockReason.SCORE_BELOW_MIN, details);
        }
        if (score.strength() < minScore) {
            return GateResult.block(NAME, BlockReason.SCORE_BELOW_MIN, details);
        }
        return GateResult.pass(NAME, details);
    }
}

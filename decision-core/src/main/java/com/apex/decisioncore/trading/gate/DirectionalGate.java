package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.trading.pipeline.Direction;
import com.apex.decisioncore.trading.pipeline.MarketContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class DirectionalGate implements Gate {

    public static final String NAME = "directional_gate";

    private final DecisionProperties decisionProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        DecisionProperties.Directional config = decisionProperties.getGates().getDirectional();
        Direction direction = context.getScore().direction();
        MarketContext market = context.market();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("direction", direction.label());
        details.put("regime", market.regimeLabel());
        details.put("posture", market.posture().label());
        details.put("high_volatility", market.highVolatility());

        if (config.isLongOnly() && direction == Direction.BEARISH) {
            return GateResult.block(NAME, BlockReason.LONG_ONLY_BLOCKED_SHORT_ENTRY, details);
        }
        if (market.regimeLabel() != null && config.getBlockedRegimes().stream()
                .anyMatch(blocked -> blocked.equalsIgnoreCase(market.regimeLabel()))) {
            return GateResult.block(NAME, BlockReason.REGIME_BLOCKED, details);
        }
        if (config.isRequireAlignmentInHighVol() && market.highVolatility() && market.posture() != direction) {
            return GateResult.block(NAME, BlockReason.BLOCKED_HIGH_VOL_NO_ALIGNMENT, details);
        }
        double confidence = context.getScore().directionConfidence();
        details.put("direction_confidence", confidence);
        details.put("min_direction_confidence", config.getMinDirectionConfidence());
        if (direction == Direction.NEUTRAL || confidence < config.getMinDirectionConfidence()) {
            return GateResult.block(NAME, BlockReason.DIRECTIONAL_CONFLICT, details);
        }
        return GateResult.pass(NAME, details);
    }
}

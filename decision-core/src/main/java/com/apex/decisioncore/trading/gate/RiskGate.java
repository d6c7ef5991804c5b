package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.service.CircuitBreaker;
import com.apex.decisioncore.service.TradeCooldownService;
import com.apex.decisioncore.service.TradingWindowService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class RiskGate implements Gate {

    public static final String NAME = "risk_gate";

    private final DecisionProperties decisionProperties;
    private final TradingWindowService tradingWindowService;
    private final CircuitBreaker circuitBreaker;
    private final TradeCooldownService tradeCooldownService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        String symbol = context.symbol();

        TradingWindowService.WindowDecision window = tradingWindowService.evaluate(context.getNow());
        if (!window.allowed()) {
            details.put("window", window.reason());
            return GateResult.block(NAME, BlockReason.MARKET_CLOSED, details);
        }
        if (!circuitBreaker.canEnter(context.getNow())) {
            details.put("circuit_breaker", circuitBreaker.getReason());
            details.put("halt_until", String.valueOf(circuitBreaker.getHaltUntil()));
            return GateResult.block(NAME, BlockReason.RISK_EXCEEDED, details);
        }
        long cooldown = tradeCooldownService.getRemainingCooldown(symbol, context.getNow());
        if (cooldown > 0) {
            details.put("cooldown_remaining_sec", cooldown);
            return GateResult.block(NAME, BlockReason.SYMBOL_ON_COOLDOWN, details);
        }
        if (context.getPortfolio().holds(symbol)) {
            details.put("held", true);
            return GateResult.block(NAME, BlockReason.SYMBOL_EXPOSURE_LIMIT, details);
        }
        String sector = context.getRequest().sector();
        if (sector != null) {
            long inSector = context.getPortfolio().countInSector(sector);
            int limit = decisionProperties.getGates().getRisk().getMaxPositionsPerSector();
            details.put("sector", sector);
            details.put("sector_positions", inSector);
            details.put("max_positions_per_sector", limit);
            if (inSector >= limit) {
                return GateResult.block(NAME, BlockReason.SECTOR_EXPOSURE_LIMIT, details);
            }
        }
        return GateResult.pass(NAME, details);
    }
}

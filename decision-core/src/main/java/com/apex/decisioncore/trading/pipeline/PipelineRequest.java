package com.apex.decisioncore.trading.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * @param price last price at decision time, used as the shadow entry price; may be null
 */
public record PipelineRequest(
        String cycleId,
        String symbol,
        String sector,
        Double price,
        List<SignalComponent> components,
        PortfolioSnapshot portfolio,
        MarketContext market,
        Instant timestamp
) {
    public PipelineRequest {
        components = components == null ? List.of() : List.copyOf(components);
        market = market == null ? MarketContext.neutral() : market;
    }
}

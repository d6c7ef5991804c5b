package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.trading.pipeline.MarketContext;
import com.apex.decisioncore.trading.pipeline.PipelineRequest;
import com.apex.decisioncore.trading.pipeline.PortfolioSnapshot;
import com.apex.decisioncore.trading.pipeline.SignalScore;
import lombok.Getter;

import java.time.Instant;

/**
 * Inputs shared by the stages of one candidate's gate run, plus the few facts an earlier stage hands
 * to a later one. One instance per candidate; never shared across symbols.
 */
@Getter
public class GateContext {

    private final PipelineRequest request;
    private final SignalScore score;
    private final PortfolioSnapshot portfolio;
    private final Instant now;

    private boolean displacementRequired;
    private String displacedSymbol;

    public GateContext(PipelineRequest request, SignalScore score, PortfolioSnapshot portfolio, Instant now) {
        this.request = request;
        this.score = score;
        this.portfolio = portfolio;
        this.now = now;
    }

    public String symbol() {
        return request.symbol();
    }

    public MarketContext market() {
        return request.market();
    }

    void requireDisplacement() {
        this.displacementRequired = true;
    }

    void displace(String incumbentSymbol) {
        this.displacedSymbol = incumbentSymbol;
    }
}

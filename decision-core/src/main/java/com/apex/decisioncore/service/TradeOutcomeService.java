package com.apex.decisioncore.service;

import com.apex.decisioncore.learning.AdaptiveWeightLearner;
import com.apex.decisioncore.learning.RealizedTradeOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for closed-position feedback from the execution side.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeOutcomeService {

    private final AdaptiveWeightLearner adaptiveWeightLearner;
    private final DecisionActivityTracker decisionActivityTracker;

    public int recordClosedTrade(RealizedTradeOutcome outcome) {
        decisionActivityTracker.recordClosedTrade(outcome);
        int attributed = adaptiveWeightLearner.recordOutcome(outcome);
        log.info("Closed trade {} pnl={} reason={} attributed to {} components", outcome.symbol(), outcome.pnl(),
                outcome.closeReason(), attributed);
        return attributed;
    }
}

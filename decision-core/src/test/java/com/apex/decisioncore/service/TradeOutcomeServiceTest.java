package com.apex.decisioncore.service;

import com.apex.decisioncore.learning.AdaptiveWeightLearner;
import com.apex.decisioncore.learning.RealizedTradeOutcome;
import com.apex.decisioncore.util.TestFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradeOutcomeServiceTest {

    @Test
    void closedTradeFeedsTrackerAndLearner() {
        AdaptiveWeightLearner learner = mock(AdaptiveWeightLearner.class);
        DecisionActivityTracker tracker = new DecisionActivityTracker(TestFixtures.fixedClock());
        RealizedTradeOutcome outcome = new RealizedTradeOutcome("TSLA", "bullish", 42.0, 1.2, "take_profit",
                Map.of("options_flow", 2.0, "dark_pool", 1.0), TestFixtures.NOW);
        when(learner.recordOutcome(outcome)).thenReturn(2);

        int attributed = new TradeOutcomeService(learner, tracker).recordClosedTrade(outcome);

        assertThat(attributed).isEqualTo(2);
        verify(learner).recordOutcome(outcome);
        assertThat(tracker.closedTradesSince(TestFixtures.NOW.minus(Duration.ofMinutes(1)))).containsExactly(outcome);
    }
}

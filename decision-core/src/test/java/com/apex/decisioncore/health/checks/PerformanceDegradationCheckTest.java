package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.learning.RealizedTradeOutcome;
import com.apex.decisioncore.service.CircuitBreaker;
import com.apex.decisioncore.service.DecisionActivityTracker;
import com.apex.decisioncore.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceDegradationCheckTest {

    private Clock clock;
    private HealthProperties props;
    private DecisionActivityTracker tracker;
    private CircuitBreaker breaker;
    private PerformanceDegradationCheck check;

    @BeforeEach
    void setUp() {
        clock = TestFixtures.fixedClock();
        props = new HealthProperties();
        tracker = new DecisionActivityTracker(clock);
        breaker = new CircuitBreaker(clock);
        check = new PerformanceDegradationCheck(tracker, breaker, props, clock);
    }

    @Test
    void noTradesIsHealthy() {
        assertThat(check.check().healthy()).isTrue();
    }

    @Test
    void lowWinRateOverEnoughTradesFails() {
        for (int i = 0; i < 10; i++) {
            trade(i < 3 ? 50.0 : -10.0, Duration.ofHours(i + 1));
        }

        CheckOutcome outcome = check.check();

        assertThat(outcome.healthy()).isFalse();
        assertThat(outcome.message()).contains("win rate 0.30 over 10 trades");
    }

    @Test
    void lowWinRateOverFewTradesIsTolerated() {
        for (int i = 0; i < 5; i++) {
            trade(-10.0, Duration.ofHours(i + 1));
        }

        assertThat(check.check().healthy()).isTrue();
    }

    @Test
    void largeLossFailsRegardlessOfCount() {
        trade(-1500.0, Duration.ofHours(2));

        CheckOutcome outcome = check.check();

        assertThat(outcome.healthy()).isFalse();
        assertThat(outcome.message()).contains("pnl -1500.00");
    }

    @Test
    void tradesOutsideLookbackAreIgnored() {
        trade(-1500.0, Duration.ofDays(8));

        assertThat(check.check().healthy()).isTrue();
    }

    @Test
    void remediationEngagesCircuitBreaker() throws Exception {
        String action = check.remediation().orElseThrow().run();

        assertThat(action).startsWith("circuit breaker engaged until");
        assertThat(breaker.canEnter(clock.instant())).isFalse();
        assertThat(breaker.getReason()).isEqualTo("performance_degradation");
        assertThat(breaker.getHaltUntil()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));
    }

    private void trade(double pnl, Duration ago) {
        tracker.recordClosedTrade(new RealizedTradeOutcome("TSLA", "bullish", pnl, pnl / 100, "exit",
                Map.of("options_flow", 1.0), clock.instant().minus(ago)));
    }
}

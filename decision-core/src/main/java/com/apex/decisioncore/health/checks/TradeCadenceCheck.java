package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.HealthSeverity;
import com.apex.decisioncore.service.DecisionActivityTracker;
import com.apex.decisioncore.service.TradingWindowService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Flags a session with decision cycles running but no entries for longer than the cadence window.
 */
@Component
@RequiredArgsConstructor
public class TradeCadenceCheck implements HealthCheck {

    private final DecisionActivityTracker activityTracker;
    private final TradingWindowService tradingWindowService;
    private final HealthProperties healthProperties;
    private final Clock clock;

    @Override
    public String name() {
        return "trade_cadence";
    }

    @Override
    public HealthSeverity severity() {
        return HealthSeverity.WARN;
    }

    @Override
    public Duration interval() {
        return healthProperties.getTradeCadence().getInterval();
    }

    @Override
    public CheckOutcome check() {
        Instant now = clock.instant();
        if (!tradingWindowService.isMarketHours(now)) {
            return CheckOutcome.healthy("outside market hours");
        }
        if (activityTracker.getLastCycleAt().isEmpty()) {
            return CheckOutcome.healthy("no decision cycle has run yet");
        }
        Instant reference = activityTracker.getLastEntryAt().orElse(activityTracker.getStartedAt());
        Duration quiet = Duration.between(reference, now);
        Duration window = healthProperties.getTradeCadence().getWindow();
        if (quiet.compareTo(window) > 0) {
            return CheckOutcome.unhealthy("no entries for " + quiet.toMinutes() + " min during market hours");
        }
        return CheckOutcome.healthy("last entry " + quiet.toMinutes() + " min ago");
    }
}

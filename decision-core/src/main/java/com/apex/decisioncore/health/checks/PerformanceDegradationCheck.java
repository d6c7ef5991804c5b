package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.HealthSeverity;
import com.apex.decisioncore.health.Remediation;
import com.apex.decisioncore.learning.RealizedTradeOutcome;
import com.apex.decisioncore.service.CircuitBreaker;
import com.apex.decisioncore.service.DecisionActivityTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fails on a poor win rate over enough recent trades, or on a large cumulative loss. Remediation halts
 * new entries through the circuit breaker for a fixed period.
 */
@Component
@RequiredArgsConstructor
public class PerformanceDegradationCheck implements HealthCheck {

    private final DecisionActivityTracker activityTracker;
    private final CircuitBreaker circuitBreaker;
    private final HealthProperties healthProperties;
    private final Clock clock;

    @Override
    public String name() {
        return "performance_degradation";
    }

    @Override
    public HealthSeverity severity() {
        return HealthSeverity.WARN;
    }

    @Override
    public Duration interval() {
        return healthProperties.getPerformance().getInterval();
    }

    @Override
    public CheckOutcome check() {
        HealthProperties.Performance config = healthProperties.getPerformance();
        Instant since = clock.instant().minus(config.getLookback());
        List<RealizedTradeOutcome> trades = activityTracker.closedTradesSince(since);
        if (trades.isEmpty()) {
            return CheckOutcome.healthy("no closed trades in lookback");
        }
        long wins = trades.stream().filter(trade -> trade.pnl() > 0).count();
        double winRate = (double) wins / trades.size();
        double pnl = trades.stream().mapToDouble(RealizedTradeOutcome::pnl).filter(Double::isFinite).sum();

        if (trades.size() >= config.getMinTrades() && winRate < config.getMinWinRate()) {
            return CheckOutcome.unhealthy(String.format(Locale.ROOT, "win rate %.2f over %d trades below %.2f",
                    winRate, trades.size(), config.getMinWinRate()));
        }
        if (pnl < -config.getMaxLoss()) {
            return CheckOutcome.unhealthy(String.format(Locale.ROOT, "pnl %.2f over lookback below -%.2f", pnl, config.getMaxLoss()));
        }
        return CheckOutcome.healthy(String.format(Locale.ROOT, "win rate %.2f over %d trades, pnl %.2f",
                winRate, trades.size(), pnl));
    }

    @Override
    public Optional<Remediation> remediation() {
        return Optional.of(() -> {
            Instant until = clock.instant().plus(healthProperties.getPerformance().getBreakerDuration());
            circuitBreaker.engage("performance_degradation", until);
            return "circuit breaker engaged until " + until;
        });
    }
}

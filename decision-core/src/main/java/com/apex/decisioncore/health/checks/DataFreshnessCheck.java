package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.HealthSeverity;
import com.apex.decisioncore.health.MarketDataFreshnessProvider;
import com.apex.decisioncore.health.Remediation;
import com.apex.decisioncore.service.TradingWindowService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class DataFreshnessCheck implements HealthCheck {

    private final MarketDataFreshnessProvider freshnessProvider;
    private final TradingWindowService tradingWindowService;
    private final HealthProperties healthProperties;
    private final Clock clock;

    @Override
    public String name() {
        return "data_freshness";
    }

    @Override
    public HealthSeverity severity() {
        return HealthSeverity.WARN;
    }

    @Override
    public Duration interval() {
        return healthProperties.getDataFreshness().getInterval();
    }

    @Override
    public CheckOutcome check() {
        Instant now = clock.instant();
        if (!tradingWindowService.isMarketHours(now)) {
            return CheckOutcome.healthy("outside market hours");
        }
        Optional<Instant> lastUpdate = freshnessProvider.lastUpdate();
        if (lastUpdate.isEmpty()) {
            return CheckOutcome.unhealthy("no market data received yet");
        }
        Duration age = Duration.between(lastUpdate.get(), now);
        Duration maxAge = healthProperties.getDataFreshness().getMaxAge();
        if (age.compareTo(maxAge) > 0) {
            return CheckOutcome.unhealthy("market data is " + age.getSeconds() + "s old (max " + maxAge.getSeconds() + "s)");
        }
        return CheckOutcome.healthy("market data age " + age.getSeconds() + "s");
    }

    @Override
    public Optional<Remediation> remediation() {
        return Optional.of(() -> {
            freshnessProvider.requestRefresh();
            return "requested market data refresh";
        });
    }
}

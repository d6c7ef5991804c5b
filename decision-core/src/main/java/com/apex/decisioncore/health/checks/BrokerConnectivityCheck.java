package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.BrokerConnectivityProbe;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.HealthSeverity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class BrokerConnectivityCheck implements HealthCheck {

    private final BrokerConnectivityProbe probe;
    private final HealthProperties healthProperties;

    @Override
    public String name() {
        return "broker_connectivity";
    }

    @Override
    public HealthSeverity severity() {
        return HealthSeverity.CRITICAL;
    }

    @Override
    public Duration interval() {
        return healthProperties.getBroker().getInterval();
    }

    @Override
    public CheckOutcome check() {
        return probe.isConnected()
                ? CheckOutcome.healthy("broker reachable")
                : CheckOutcome.unhealthy("broker unreachable");
    }
}

package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.HealthSeverity;
import com.apex.decisioncore.trading.pipeline.PositionSnapshotProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Compares the positions the decision core works from with the count the broker reports.
 */
@Component
@RequiredArgsConstructor
public class PositionConsistencyCheck implements HealthCheck {

    private final PositionSnapshotProvider positionSnapshotProvider;
    private final HealthProperties healthProperties;

    @Override
    public String name() {
        return "position_consistency";
    }

    @Override
    public HealthSeverity severity() {
        return HealthSeverity.CRITICAL;
    }

    @Override
    public Duration interval() {
        return healthProperties.getPositions().getInterval();
    }

    @Override
    public CheckOutcome check() {
        int tracked = positionSnapshotProvider.snapshot().size();
        OptionalInt broker = positionSnapshotProvider.brokerPositionCount();
        if (broker.isEmpty()) {
            return CheckOutcome.healthy("broker count unavailable, tracking " + tracked);
        }
        if (broker.getAsInt() != tracked) {
            return CheckOutcome.unhealthy("tracked " + tracked + " positions, broker reports " + broker.getAsInt());
        }
        return CheckOutcome.healthy(tracked + " positions in sync");
    }
}

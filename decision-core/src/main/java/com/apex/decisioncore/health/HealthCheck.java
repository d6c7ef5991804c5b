package com.apex.decisioncore.health;

import java.time.Duration;
import java.util.Optional;

/**
 * One periodic probe run by {@link HealthSupervisor}. Implementations only observe; anything that
 * changes state belongs in {@link #remediation()}.
 */
public interface HealthCheck {

    String name();

    HealthSeverity severity();

    Duration interval();

    CheckOutcome check();

    default Optional<Remediation> remediation() {
        return Optional.empty();
    }
}

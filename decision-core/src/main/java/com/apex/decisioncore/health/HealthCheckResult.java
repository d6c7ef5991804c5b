package com.apex.decisioncore.health;

import java.time.Instant;

/**
 * @param remediationSucceeded null unless a remediation was attempted on this run
 */
public record HealthCheckResult(
        String name,
        HealthSeverity severity,
        HealthStatus status,
        int consecutiveFailures,
        boolean remediationAttempted,
        Boolean remediationSucceeded,
        String remediationError,
        String message,
        Instant checkedAt
) {
    public boolean healthy() {
        return status == HealthStatus.HEALTHY;
    }
}

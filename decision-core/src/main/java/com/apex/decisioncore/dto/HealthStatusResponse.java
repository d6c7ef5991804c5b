package com.apex.decisioncore.dto;

import com.apex.decisioncore.health.HealthCheckResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatusResponse {

    private boolean overallHealthy;
    private Instant generatedAt;
    private boolean circuitBreakerEngaged;
    private Instant circuitBreakerUntil;
    private List<HealthCheckResult> checks;
}

package com.apex.decisioncore.controller;

import com.apex.decisioncore.dto.HealthStatusResponse;
import com.apex.decisioncore.exception.NotFoundException;
import com.apex.decisioncore.health.HealthCheckResult;
import com.apex.decisioncore.health.HealthSupervisor;
import com.apex.decisioncore.service.CircuitBreaker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final HealthSupervisor healthSupervisor;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    @GetMapping("/checks")
    @Operation(summary = "Latest result of every health check")
    public ResponseEntity<HealthStatusResponse> checks() {
        HealthStatusResponse response = HealthStatusResponse.builder()
                .overallHealthy(healthSupervisor.overallHealthy())
                .generatedAt(clock.instant())
                .circuitBreakerEngaged(!circuitBreaker.canEnter(clock.instant()))
                .circuitBreakerUntil(circuitBreaker.getHaltUntil())
                .checks(healthSupervisor.latestResults())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/checks/{name}")
    @Operation(summary = "Latest result of one health check")
    public ResponseEntity<HealthCheckResult> check(@PathVariable String name) {
        return healthSupervisor.latest(name)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("health_check", name));
    }
}

package com.apex.decisioncore.health;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.service.SupervisedTaskRunner;
import com.apex.decisioncore.telemetry.EventType;
import com.apex.decisioncore.telemetry.JsonlEventWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered check on its own interval, off the decision path. Remediation fires once when a
 * failure streak reaches the threshold and is re-armed only by a healthy result. A run that outlives the
 * check timeout is reported as an error; if it completes later its result is dropped because a newer
 * run has superseded it.
 */
@Service
@Slf4j
public class HealthSupervisor {

    private final ObjectProvider<HealthCheck> registeredChecks;
    private final SupervisedTaskRunner supervisedTaskRunner;
    private final HealthProperties healthProperties;
    private final Executor healthCheckExecutor;
    private final JsonlEventWriter eventWriter;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, CheckState> states = new ConcurrentHashMap<>();

    public HealthSupervisor(ObjectProvider<HealthCheck> registeredChecks,
                            SupervisedTaskRunner supervisedTaskRunner,
                            HealthProperties healthProperties,
                            @Qualifier("healthCheckExecutor") Executor healthCheckExecutor,
                            JsonlEventWriter eventWriter,
                            MetricsService metricsService,
                            Clock clock) {
        this.registeredChecks = registeredChecks;
        this.supervisedTaskRunner = supervisedTaskRunner;
        this.healthProperties = healthProperties;
        this.healthCheckExecutor = healthCheckExecutor;
        this.eventWriter = eventWriter;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    static final class CheckState {
        private int consecutiveFailures;
        private boolean remediationFired;
        private long generation;
        private Instant lastStartedAt;
        private HealthCheckResult latest;
    }

    /**
     * Starts every check whose interval has elapsed since its previous start.
     *
     * @return number of checks started
     */
    public int tick() {
        if (!healthProperties.isEnabled()) {
            return 0;
        }
        Instant now = clock.instant();
        int started = 0;
        for (HealthCheck check : allChecks()) {
            CheckState state = states.computeIfAbsent(check.name(), name -> new CheckState());
            long generation;
            synchronized (state) {
                if (state.lastStartedAt != null && now.isBefore(state.lastStartedAt.plus(check.interval()))) {
                    continue;
                }
                state.lastStartedAt = now;
                generation = ++state.generation;
            }
            launch(check, generation);
            started++;
        }
        return started;
    }

    public List<HealthCheck> allChecks() {
        List<HealthCheck> checks = new ArrayList<>();
        registeredChecks.orderedStream().forEach(checks::add);
        checks.addAll(supervisedTaskRunner.livenessChecks());
        return checks;
    }

    public List<HealthCheckResult> latestResults() {
        List<HealthCheckResult> results = new ArrayList<>();
        states.values().forEach(state -> {
            synchronized (state) {
                if (state.latest != null) {
                    results.add(state.latest);
                }
            }
        });
        results.sort(Comparator.comparing(HealthCheckResult::name));
        return results;
    }

    public Optional<HealthCheckResult> latest(String checkName) {
        CheckState state = states.get(checkName);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.ofNullable(state.latest);
        }
    }

    /**
     * False while any critical check is failing. Errored checks are reported as critical.
     */
    public boolean overallHealthy() {
        return latestResults().stream()
                .noneMatch(result -> !result.healthy() && result.severity() == HealthSeverity.CRITICAL);
    }

    private void launch(HealthCheck check, long generation) {
        long timeoutMs = healthProperties.getCheckTimeout().toMillis();
        CompletableFuture.supplyAsync(check::check, healthCheckExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((outcome, error) -> complete(check, generation, outcome, error));
    }

    HealthCheckResult complete(HealthCheck check, long generation, CheckOutcome outcome, Throwable error) {
        CheckState state = states.computeIfAbsent(check.name(), name -> new CheckState());
        HealthCheckResult result;
        synchronized (state) {
            if (generation != state.generation) {
                log.debug("Dropping superseded result of {} (run {} < {})", check.name(), generation,
                        state.generation);
                return null;
            }
            result = evaluate(check, state, outcome, unwrap(error));
            state.latest = result;
        }
        publish(result);
        return result;
    }

    private HealthCheckResult evaluate(HealthCheck check, CheckState state, CheckOutcome outcome, Throwable error) {
        Instant now = clock.instant();
        HealthStatus status;
        HealthSeverity severity = check.severity();
        String message;
        if (error != null) {
            status = HealthStatus.ERROR;
            severity = HealthSeverity.CRITICAL;
            message = error instanceof TimeoutException
                    ? "check timed out after " + healthProperties.getCheckTimeout()
                    : error.getClass().getSimpleName() + ": " + error.getMessage();
        } else if (outcome == null) {
            status = HealthStatus.ERROR;
            severity = HealthSeverity.CRITICAL;
            message = "check returned no outcome";
        } else {
            status = outcome.healthy() ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
            message = outcome.message();
        }

        if (status == HealthStatus.HEALTHY) {
            state.consecutiveFailures = 0;
            state.remediationFired = false;
            return new HealthCheckResult(check.name(), severity, status, 0, false, null, null, message, now);
        }

        state.consecutiveFailures++;
        boolean attempted = false;
        Boolean succeeded = null;
        String remediationError = null;
        Optional<Remediation> remediation = check.remediation();
        if (remediation.isPresent() && !state.remediationFired
                && state.consecutiveFailures >= healthProperties.getRemediationThreshold()) {
            state.remediationFired = true;
            attempted = true;
            try {
                String action = remediation.get().run();
                succeeded = true;
                log.warn("Remediation for {} ran after {} failures: {}", check.name(), state.consecutiveFailures,
                        action);
            } catch (Exception e) {
                succeeded = false;
                remediationError = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("Remediation for {} failed", check.name(), e);
            }
            metricsService.recordRemediation(check.name(), succeeded);
        }
        return new HealthCheckResult(check.name(), severity, status, state.consecutiveFailures, attempted,
                succeeded, remediationError, message, now);
    }

    private void publish(HealthCheckResult result) {
        metricsService.recordHealthCheck(result.name(), result.status().name());
        if (!result.healthy()) {
            log.warn("Health check {} {} severity={} failures={} message={}", result.name(), result.status(),
                    result.severity(), result.consecutiveFailures(), result.message());
        }
        try {
            eventWriter.append(EventType.HEALTH_CHECK, result);
        } catch (RuntimeException e) {
            log.error("Failed to log health check result for {}", result.name(), e);
        }
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

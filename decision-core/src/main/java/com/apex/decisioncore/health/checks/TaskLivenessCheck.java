package com.apex.decisioncore.health.checks;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.CheckOutcome;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.HealthSeverity;
import com.apex.decisioncore.health.Remediation;
import com.apex.decisioncore.service.SupervisedTask;
import com.apex.decisioncore.service.SupervisedTaskRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Watchdog for one supervised task: fails when the task's heartbeat has not moved for several of its
 * intervals; remediation restarts the task within its hourly budget.
 */
public class TaskLivenessCheck implements HealthCheck {

    public static final String PREFIX = "task_liveness:";

    private final SupervisedTask task;
    private final SupervisedTaskRunner runner;
    private final HealthProperties healthProperties;
    private final Clock clock;

    public TaskLivenessCheck(SupervisedTask task, SupervisedTaskRunner runner, HealthProperties healthProperties,
                             Clock clock) {
        this.task = task;
        this.runner = runner;
        this.healthProperties = healthProperties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return PREFIX + task.getName();
    }

    @Override
    public HealthSeverity severity() {
        return HealthSeverity.CRITICAL;
    }

    @Override
    public Duration interval() {
        return healthProperties.getTaskLiveness().getInterval();
    }

    @Override
    public CheckOutcome check() {
        Instant now = clock.instant();
        Duration silence = Duration.between(task.getLastHeartbeat(), now);
        if (runner.isStale(task, now)) {
            return CheckOutcome.unhealthy("no heartbeat for " + silence.getSeconds() + "s (interval "
                    + task.getInterval().getSeconds() + "s)");
        }
        return CheckOutcome.healthy("heartbeat " + silence.getSeconds() + "s ago, runs=" + task.getRuns());
    }

    @Override
    public Optional<Remediation> remediation() {
        return Optional.of(() -> runner.restart(task.getName()));
    }
}

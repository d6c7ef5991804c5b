package com.apex.decisioncore.service;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.checks.TaskLivenessCheck;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the background loops: schedules each one with a fixed delay, runs every iteration through
 * {@link ScheduledTaskGuard}, and restarts a stalled loop a bounded number of times per hour.
 */
@Service
@Slf4j
public class SupervisedTaskRunner {

    private static final Duration RESTART_WINDOW = Duration.ofHours(1);

    private final TaskScheduler scheduler;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final HealthProperties healthProperties;
    private final Clock clock;

    private final Map<String, SupervisedTask> tasks = new ConcurrentHashMap<>();

    public SupervisedTaskRunner(@Qualifier("supervisedTaskScheduler") TaskScheduler scheduler,
                                ScheduledTaskGuard scheduledTaskGuard,
                                HealthProperties healthProperties,
                                Clock clock) {
        this.scheduler = scheduler;
        this.scheduledTaskGuard = scheduledTaskGuard;
        this.healthProperties = healthProperties;
        this.clock = clock;
    }

    public SupervisedTask start(String name, Duration interval, Runnable body) {
        SupervisedTask task = new SupervisedTask(name, interval, body, clock.instant());
        if (tasks.putIfAbsent(name, task) != null) {
            throw new IllegalStateException("Supervised task " + name + " already registered");
        }
        schedule(task);
        log.info("Started supervised task {} every {}", name, interval);
        return task;
    }

    /**
     * Runs one iteration of the task on the calling thread.
     */
    public boolean runOnce(SupervisedTask task) {
        task.heartbeat(clock.instant());
        boolean success = scheduledTaskGuard.run(task.getName(), task.body());
        task.completed(clock.instant(), success);
        return success;
    }

    public boolean isStale(SupervisedTask task, Instant now) {
        Duration allowed = task.getInterval().multipliedBy(healthProperties.getTaskLiveness().getStaleAfterIntervals());
        return task.getLastHeartbeat().plus(allowed).isBefore(now);
    }

    /**
     * Cancels and reschedules the task if it still has restart budget in the current hour.
     *
     * @throws IllegalStateException when the task is unknown or its budget is used up
     */
    public String restart(String name) {
        SupervisedTask task = tasks.get(name);
        if (task == null) {
            throw new IllegalStateException("Unknown supervised task " + name);
        }
        Instant now = clock.instant();
        int budget = healthProperties.getTaskLiveness().getMaxRestartsPerHour();
        int used = task.restartsSince(now.minus(RESTART_WINDOW));
        if (used >= budget) {
            throw new IllegalStateException("Restart budget exhausted for " + name + " (" + used + "/" + budget + ")");
        }
        task.recordRestart(now);
        task.heartbeat(now);
        schedule(task);
        log.warn("Restarted supervised task {} ({} of {} this hour)", name, used + 1, budget);
        return "restarted " + name;
    }

    public Optional<SupervisedTask> task(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public List<SupervisedTask> tasks() {
        return new ArrayList<>(tasks.values());
    }

    public List<HealthCheck> livenessChecks() {
        List<HealthCheck> checks = new ArrayList<>();
        for (SupervisedTask task : tasks.values()) {
            checks.add(new TaskLivenessCheck(task, this, healthProperties, clock));
        }
        return checks;
    }

    @PreDestroy
    public void stopAll() {
        tasks.values().forEach(task -> {
            ScheduledFuture<?> future = task.replaceFuture(null);
            if (future != null) {
                future.cancel(false);
            }
        });
    }

    private void schedule(SupervisedTask task) {
        ScheduledFuture<?> next = scheduler.scheduleWithFixedDelay(() -> runOnce(task), task.getInterval());
        ScheduledFuture<?> previous = task.replaceFuture(next);
        if (previous != null) {
            previous.cancel(true);
        }
    }
}

package com.apex.decisioncore.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    /**
     * Runs {@code task}, logging and counting any failure instead of letting it kill the scheduler thread.
     *
     * @return whether the task completed normally
     */
    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            metricsService.recordTaskFailure(taskName);
            return false;
        }
    }
}

package com.apex.decisioncore.service;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.health.HealthCheck;
import com.apex.decisioncore.health.checks.TaskLivenessCheck;
import com.apex.decisioncore.util.MutableClock;
import com.apex.decisioncore.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SupervisedTaskRunnerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private MutableClock clock;
    private TaskScheduler scheduler;
    private SupervisedTaskRunner runner;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        scheduler = mock(TaskScheduler.class);
        when(scheduler.scheduleWithFixedDelay(any(Runnable.class), any(Duration.class)))
                .thenAnswer(invocation -> mock(ScheduledFuture.class));
        runner = new SupervisedTaskRunner(scheduler, new ScheduledTaskGuard(TestFixtures.metrics()),
                new HealthProperties(), clock);
    }

    @Test
    void startSchedulesWithFixedDelay() {
        SupervisedTask task = runner.start("decision_cycle", INTERVAL, () -> { });

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(INTERVAL));
        assertThat(task.getLastHeartbeat()).isEqualTo(TestFixtures.NOW);
        assertThat(runner.task("decision_cycle")).containsSame(task);
    }

    @Test
    void duplicateNameIsRejected() {
        runner.start("decision_cycle", INTERVAL, () -> { });

        assertThatThrownBy(() -> runner.start("decision_cycle", INTERVAL, () -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void runOnceRecordsSuccessAndFailure() {
        AtomicInteger calls = new AtomicInteger();
        SupervisedTask ok = runner.start("ok", INTERVAL, calls::incrementAndGet);
        SupervisedTask failing = runner.start("failing", INTERVAL, () -> {
            throw new IllegalStateException("boom");
        });
        clock.advance(Duration.ofSeconds(5));

        assertThat(runner.runOnce(ok)).isTrue();
        assertThat(runner.runOnce(failing)).isFalse();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(ok.getRuns()).isEqualTo(1);
        assertThat(ok.getLastSuccessAt()).isEqualTo(clock.instant());
        assertThat(failing.getLastError()).isNotNull();
        assertThat(failing.getLastHeartbeat()).isEqualTo(clock.instant());
    }

    @Test
    void taskIsStaleAfterSeveralSilentIntervals() {
        SupervisedTask task = runner.start("decision_cycle", INTERVAL, () -> { });

        clock.advance(Duration.ofSeconds(90));
        assertThat(runner.isStale(task, clock.instant())).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(runner.isStale(task, clock.instant())).isTrue();
    }

    @Test
    void restartIsBoundedPerHour() {
        runner.start("decision_cycle", INTERVAL, () -> { });

        for (int i = 0; i < 3; i++) {
            assertThat(runner.restart("decision_cycle")).isEqualTo("restarted decision_cycle");
        }
        assertThatThrownBy(() -> runner.restart("decision_cycle"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("budget exhausted");
        verify(scheduler, times(4)).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));

        clock.advance(Duration.ofMinutes(61));
        assertThat(runner.restart("decision_cycle")).isEqualTo("restarted decision_cycle");
    }

    @Test
    void restartOfUnknownTaskFails() {
        assertThatThrownBy(() -> runner.restart("missing")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void everyTaskGetsALivenessCheck() {
        SupervisedTask task = runner.start("shadow_evaluation", INTERVAL, () -> { });

        assertThat(runner.livenessChecks()).extracting(HealthCheck::name)
                .containsExactly(TaskLivenessCheck.PREFIX + "shadow_evaluation");

        clock.advance(Duration.ofMinutes(5));
        HealthCheck check = runner.livenessChecks().get(0);
        assertThat(check.check().healthy()).isFalse();

        runner.runOnce(task);
        assertThat(check.check().healthy()).isTrue();
    }
}

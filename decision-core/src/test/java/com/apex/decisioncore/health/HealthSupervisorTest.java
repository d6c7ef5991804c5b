package com.apex.decisioncore.health;

import com.apex.decisioncore.config.HealthProperties;
import com.apex.decisioncore.service.SupervisedTaskRunner;
import com.apex.decisioncore.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthSupervisorTest {

    @TempDir
    Path tempDir;

    private HealthProperties props;
    private List<HealthCheck> checks;
    private HealthSupervisor supervisor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        Clock clock = TestFixtures.fixedClock();
        props = new HealthProperties();
        checks = new ArrayList<>();
        ObjectProvider<HealthCheck> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenAnswer(invocation -> checks.stream());
        SupervisedTaskRunner runner = mock(SupervisedTaskRunner.class);
        when(runner.livenessChecks()).thenReturn(List.of());
        supervisor = new HealthSupervisor(provider, runner, props, Runnable::run,
                TestFixtures.eventWriter(tempDir, clock), TestFixtures.metrics(), clock);
    }

    @Test
    void remediationFiresOncePerFailureStreak() {
        FakeCheck check = new FakeCheck("broker_connectivity", HealthSeverity.CRITICAL);
        checks.add(check);

        check.healthy.set(false);
        supervisor.tick();
        supervisor.tick();
        assertThat(check.remediations.get()).isZero();

        supervisor.tick();
        HealthCheckResult third = supervisor.latest("broker_connectivity").orElseThrow();
        assertThat(third.consecutiveFailures()).isEqualTo(3);
        assertThat(third.remediationAttempted()).isTrue();
        assertThat(third.remediationSucceeded()).isTrue();
        assertThat(check.remediations.get()).isEqualTo(1);

        supervisor.tick();
        supervisor.tick();
        assertThat(check.remediations.get()).isEqualTo(1);
        assertThat(supervisor.latest("broker_connectivity").orElseThrow().remediationAttempted()).isFalse();
    }

    @Test
    void healthyResultRearmsRemediation() {
        FakeCheck check = new FakeCheck("data_freshness", HealthSeverity.WARN);
        checks.add(check);

        check.healthy.set(false);
        for (int i = 0; i < 3; i++) {
            supervisor.tick();
        }
        check.healthy.set(true);
        supervisor.tick();
        assertThat(supervisor.latest("data_freshness").orElseThrow().consecutiveFailures()).isZero();

        check.healthy.set(false);
        for (int i = 0; i < 3; i++) {
            supervisor.tick();
        }
        assertThat(check.remediations.get()).isEqualTo(2);
    }

    @Test
    void failedRemediationIsRecorded() {
        FakeCheck check = new FakeCheck("position_consistency", HealthSeverity.CRITICAL);
        check.remediationFails = true;
        checks.add(check);
        check.healthy.set(false);

        for (int i = 0; i < 3; i++) {
            supervisor.tick();
        }

        HealthCheckResult result = supervisor.latest("position_consistency").orElseThrow();
        assertThat(result.remediationAttempted()).isTrue();
        assertThat(result.remediationSucceeded()).isFalse();
        assertThat(result.remediationError()).contains("refresh rejected");
    }

    @Test
    void throwingCheckIsCriticalError() {
        FakeCheck check = new FakeCheck("trade_cadence", HealthSeverity.WARN);
        check.throwOnCheck = true;
        checks.add(check);

        supervisor.tick();

        HealthCheckResult result = supervisor.latest("trade_cadence").orElseThrow();
        assertThat(result.status()).isEqualTo(HealthStatus.ERROR);
        assertThat(result.severity()).isEqualTo(HealthSeverity.CRITICAL);
        assertThat(supervisor.overallHealthy()).isFalse();
    }

    @Test
    void failingWarnCheckDoesNotMakeSystemUnhealthy() {
        FakeCheck warn = new FakeCheck("trade_cadence", HealthSeverity.WARN);
        warn.healthy.set(false);
        checks.add(warn);
        checks.add(new FakeCheck("broker_connectivity", HealthSeverity.CRITICAL));

        supervisor.tick();

        assertThat(supervisor.latestResults()).extracting(HealthCheckResult::name)
                .containsExactly("broker_connectivity", "trade_cadence");
        assertThat(supervisor.overallHealthy()).isTrue();
    }

    @Test
    void timedOutRunIsReportedAndLateResultDropped() {
        FakeCheck check = new FakeCheck("broker_connectivity", HealthSeverity.CRITICAL);
        checks.add(check);
        supervisor.tick();

        HealthCheckResult timedOut = supervisor.complete(check, 1, null, new TimeoutException());
        HealthCheckResult late = supervisor.complete(check, 0, CheckOutcome.healthy("late"), null);

        assertThat(timedOut.status()).isEqualTo(HealthStatus.ERROR);
        assertThat(timedOut.message()).contains("timed out");
        assertThat(late).isNull();
        assertThat(supervisor.latest("broker_connectivity").orElseThrow().status()).isEqualTo(HealthStatus.ERROR);
    }

    @Test
    void checkRunsOnlyWhenItsIntervalElapsed() {
        FakeCheck check = new FakeCheck("performance_degradation", HealthSeverity.WARN);
        check.interval = Duration.ofMinutes(5);
        checks.add(check);

        assertThat(supervisor.tick()).isEqualTo(1);
        assertThat(supervisor.tick()).isZero();
        assertThat(check.runs.get()).isEqualTo(1);
    }

    @Test
    void disabledSupervisorRunsNothing() {
        props.setEnabled(false);
        checks.add(new FakeCheck("broker_connectivity", HealthSeverity.CRITICAL));

        assertThat(supervisor.tick()).isZero();
        assertThat(supervisor.latestResults()).isEmpty();
    }

    private static final class FakeCheck implements HealthCheck {
        private final String name;
        private final HealthSeverity severity;
        private final AtomicBoolean healthy = new AtomicBoolean(true);
        private final AtomicInteger remediations = new AtomicInteger();
        private final AtomicInteger runs = new AtomicInteger();
        private Duration interval = Duration.ZERO;
        private boolean throwOnCheck;
        private boolean remediationFails;

        private FakeCheck(String name, HealthSeverity severity) {
            this.name = name;
            this.severity = severity;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public HealthSeverity severity() {
            return severity;
        }

        @Override
        public Duration interval() {
            return interval;
        }

        @Override
        public CheckOutcome check() {
            runs.incrementAndGet();
            if (throwOnCheck) {
                throw new IllegalStateException("probe crashed");
            }
            return healthy.get() ? CheckOutcome.healthy("ok") : CheckOutcome.unhealthy("down");
        }

        @Override
        public Optional<Remediation> remediation() {
            return Optional.of(() -> {
                remediations.incrementAndGet();
                if (remediationFails) {
                    throw new IllegalStateException("refresh rejected");
                }
                return "remediated";
            });
        }
    }
}

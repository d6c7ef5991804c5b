package com.apex.decisioncore.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    @Qualifier("tradingExecutor")
    private Executor tradingExecutor;

    @Autowired
    @Qualifier("healthCheckExecutor")
    private Executor healthCheckExecutor;

    @Autowired
    @Qualifier("supervisedTaskScheduler")
    private TaskScheduler supervisedTaskScheduler;

    @Autowired
    private DecisionProperties decisionProperties;

    @Test
    void tradingExecutorFollowsCycleParallelism() {
        assertThat(tradingExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) tradingExecutor;
        int parallelism = decisionProperties.getCycle().getParallelism();
        assertThat(executor.getCorePoolSize()).isEqualTo(parallelism);
        assertThat(executor.getMaxPoolSize()).isEqualTo(parallelism);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("trading-");
        assertThat(executor.getQueueCapacity()).isEqualTo(500);
    }

    @Test
    void healthChecksRunOnTheirOwnPool() {
        assertThat(healthCheckExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) healthCheckExecutor;
        assertThat(executor.getThreadNamePrefix()).isEqualTo("health-");
        assertThat(executor.getQueueCapacity()).isEqualTo(50);
        assertThat(executor).isNotSameAs(tradingExecutor);
    }

    @Test
    void supervisedLoopsHaveADedicatedScheduler() {
        assertThat(supervisedTaskScheduler).isInstanceOf(ThreadPoolTaskScheduler.class);
        assertThat(((ThreadPoolTaskScheduler) supervisedTaskScheduler).getThreadNamePrefix()).isEqualTo("supervised-");
    }
}

package com.apex.decisioncore.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "health")
@Data
@Validated
public class HealthProperties {

    private boolean enabled = true;
    private Duration checkTimeout = Duration.ofSeconds(15);

    @Min(1)
    private int remediationThreshold = 3;

    private DataFreshness dataFreshness = new DataFreshness();
    private Broker broker = new Broker();
    private Positions positions = new Positions();
    private TradeCadence tradeCadence = new TradeCadence();
    private Performance performance = new Performance();
    private TaskLiveness taskLiveness = new TaskLiveness();

    @Data
    public static class DataFreshness {
        private Duration interval = Duration.ofSeconds(60);
        private Duration maxAge = Duration.ofMinutes(5);
    }

    @Data
    public static class Broker {
        private Duration interval = Duration.ofSeconds(60);
    }

    @Data
    public static class Positions {
        private Duration interval = Duration.ofSeconds(120);
    }

    @Data
    public static class TradeCadence {
        private Duration interval = Duration.ofMinutes(5);
        private Duration window = Duration.ofHours(1);
    }

    @Data
    public static class Performance {
        private Duration interval = Duration.ofMinutes(5);
        private Duration lookback = Duration.ofDays(7);
        @Min(1)
        private int minTrades = 10;
        @Positive
        private double minWinRate = 0.35;
        private double maxLoss = 1000.0;
        private Duration breakerDuration = Duration.ofHours(1);
    }

    @Data
    public static class TaskLiveness {
        private Duration interval = Duration.ofSeconds(60);
        /** A task whose last heartbeat is older than this many of its own intervals is considered stalled. */
        @Min(2)
        private int staleAfterIntervals = 3;
        @Min(0)
        private int maxRestartsPerHour = 3;
    }
}

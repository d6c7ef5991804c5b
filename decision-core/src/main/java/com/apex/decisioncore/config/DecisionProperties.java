package com.apex.decisioncore.config;

import com.apex.decisioncore.trading.pipeline.SignalLayer;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "decision")
@Data
@Validated
public class DecisionProperties {

    private Aggregator aggregator = new Aggregator();
    private Gates gates = new Gates();
    private Trace trace = new Trace();
    private Cycle cycle = new Cycle();
    private TradingWindow tradingWindow = new TradingWindow();

    @Data
    public static class Aggregator {
        @Positive
        private double normalizationCap = 10.0;
        private SignalLayer defaultLayer = SignalLayer.OTHER;
    }

    @Data
    public static class Gates {
        private Score score = new Score();
        private Capacity capacity = new Capacity();
        private Risk risk = new Risk();
        private Displacement displacement = new Displacement();
        private Directional directional = new Directional();
    }

    @Data
    public static class Score {
        @PositiveOrZero
        private double minScore = 2.5;
    }

    @Data
    public static class Capacity {
        @Min(1)
        private int maxPositions = 16;
        private boolean displacementEnabled = true;
    }

    @Data
    public static class Risk {
        @Min(1)
        private int maxPositionsPerSector = 4;
    }

    @Data
    public static class Displacement {
        private Duration minHold = Duration.ofMinutes(20);
        @PositiveOrZero
        private double minDeltaScore = 0.75;
        @Min(0)
        private int maxPerHour = 3;
    }

    @Data
    public static class Directional {
        private boolean longOnly = false;
        private double minDirectionConfidence = 0.55;
        private boolean requireAlignmentInHighVol = true;
        private List<String> blockedRegimes = new ArrayList<>();
    }

    @Data
    public static class Trace {
        @Positive
        private int maxSerializedBytes = 500_000;
    }

    @Data
    public static class Cycle {
        @Min(1)
        private int parallelism = 1;
        private Duration interval = Duration.ofSeconds(60);
        private Duration perSymbolTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class TradingWindow {
        private boolean enabled = false;
        private String timezone = "America/New_York";
        private List<String> windows = List.of("09:35-15:45");
        private List<String> blackout = List.of();
    }
}

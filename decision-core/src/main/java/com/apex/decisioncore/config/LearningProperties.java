package com.apex.decisioncore.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "learning")
@Data
@Validated
public class LearningProperties {

    @Min(1)
    private int minSamples = 30;

    /**
     * Target half-width of the 95% confidence interval around the baseline win rate. The effective
     * sample minimum is the larger of {@link #minSamples} and the size this margin implies.
     */
    @DecimalMin("0.0")
    @DecimalMax("0.5")
    private double marginOfError = 0.18;

    @Positive
    private double criticalZ = 1.96;

    @DecimalMin("0.01")
    @DecimalMax("0.99")
    private double baselineWinRate = 0.5;

    @Positive
    private double stepFraction = 0.05;

    @Positive
    private double maxDrift = 0.5;

    private Duration minAdjustmentInterval = Duration.ofHours(24);

    private Duration interval = Duration.ofMinutes(30);

    private boolean includeShadowOutcomes = true;

    @Min(1)
    private int shadowHorizonMin = 60;

    private Map<String, Double> neutralWeights = new LinkedHashMap<>();

    public double neutralWeightFor(String component) {
        Double configured = neutralWeights.get(component);
        return configured == null ? 1.0 : configured;
    }
}

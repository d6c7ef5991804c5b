package com.apex.decisioncore.learning;

import com.apex.decisioncore.config.LearningProperties;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.shadow.ShadowIntent;
import com.apex.decisioncore.shadow.ShadowOutcome;
import com.apex.decisioncore.shadow.ShadowOutcomeListener;
import com.apex.decisioncore.telemetry.EventType;
import com.apex.decisioncore.telemetry.JsonlEventWriter;
import com.apex.decisioncore.trading.pipeline.CanonicalComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sole writer of the weight store. Outcomes are attributed to every component that was non-zero when
 * the decision was made; a learning cycle folds those samples into the bands and moves a band by one
 * small step only when its win rate differs significantly from the baseline.
 */
@Service
@Slf4j
public class AdaptiveWeightLearner implements ShadowOutcomeListener {

    static final String SKIP_INSUFFICIENT_SAMPLES = "insufficient_samples";
    static final String SKIP_COOLDOWN = "adjustment_cooldown";
    static final String SKIP_NOT_SIGNIFICANT = "not_significant";
    static final String SKIP_INVALID_STATISTICS = "invalid_statistics";
    static final String SKIP_AT_BOUND = "at_drift_bound";
    static final String SKIP_ZERO_NEUTRAL = "zero_neutral_weight";

    private final WeightStore weightStore;
    private final LearningProperties learningProperties;
    private final JsonlEventWriter eventWriter;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, long[]> pendingSamples = new HashMap<>();

    public AdaptiveWeightLearner(WeightStore weightStore, LearningProperties learningProperties,
                                 JsonlEventWriter eventWriter, MetricsService metricsService, Clock clock) {
        this.weightStore = weightStore;
        this.learningProperties = learningProperties;
        this.eventWriter = eventWriter;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Records a closed trade. A pnl of exactly zero or a non-finite pnl carries no win/loss information
     * and is skipped.
     */
    public synchronized int recordOutcome(RealizedTradeOutcome outcome) {
        if (outcome == null || !Double.isFinite(outcome.pnl()) || outcome.pnl() == 0.0) {
            log.debug("Skipping realized outcome without usable pnl: {}", outcome);
            return 0;
        }
        return attribute(outcome.components(), outcome.pnl() > 0);
    }

    @Override
    public synchronized void onShadowOutcomes(ShadowIntent intent, List<ShadowOutcome> outcomes) {
        if (!learningProperties.isIncludeShadowOutcomes()) {
            return;
        }
        for (ShadowOutcome outcome : outcomes) {
            if (!outcome.baseline() || outcome.horizonMin() != learningProperties.getShadowHorizonMin()) {
                continue;
            }
            double ret = outcome.returnPct();
            if (!Double.isFinite(ret) || ret == 0.0) {
                continue;
            }
            attribute(intent.components(), ret > 0);
        }
    }

    public synchronized int pendingSampleCount() {
        return pendingSamples.values().stream().mapToInt(counts -> (int) (counts[0] + counts[1])).sum();
    }

    public int effectiveMinSamples() {
        int fromMargin = SignificanceTest.minimumSampleSize(learningProperties.getBaselineWinRate(),
                learningProperties.getMarginOfError(), learningProperties.getCriticalZ());
        return Math.max(learningProperties.getMinSamples(), fromMargin);
    }

    /**
     * Folds pending samples into the bands, tests each band and commits all changes as one new version.
     */
    public synchronized LearningCycleResult runCycle() {
        Instant now = clock.instant();
        WeightSnapshot snapshot = weightStore.snapshot();
        Map<String, WeightBand> working = new TreeMap<>(snapshot.bands());
        Map<String, WeightBand> changes = new HashMap<>();

        pendingSamples.forEach((component, counts) -> {
            WeightBand band = working.getOrDefault(component,
                    WeightBand.neutral(component, learningProperties.neutralWeightFor(component)));
            WeightBand updated = band.withSamples(counts[0], counts[1]);
            working.put(component, updated);
            changes.put(component, updated);
        });

        int minSamples = effectiveMinSamples();
        List<WeightAdjustment> adjustments = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        for (WeightBand band : working.values()) {
            String component = band.componentName();
            if (band.sampleCount() < minSamples) {
                skipped.put(component, SKIP_INSUFFICIENT_SAMPLES);
                continue;
            }
            if (band.lastAdjustedAt() != null
                    && now.isBefore(band.lastAdjustedAt().plus(learningProperties.getMinAdjustmentInterval()))) {
                skipped.put(component, SKIP_COOLDOWN);
                continue;
            }
            SignificanceTest.Result test = SignificanceTest.test(band.wins(), band.sampleCount(),
                    learningProperties.getBaselineWinRate(), learningProperties.getCriticalZ());
            if (!Double.isFinite(test.zScore())) {
                skipped.put(component, SKIP_INVALID_STATISTICS);
                continue;
            }
            if (!test.significant()) {
                skipped.put(component, SKIP_NOT_SIGNIFICANT);
                continue;
            }
            double neutral = band.neutralWeight();
            if (neutral == 0.0) {
                skipped.put(component, SKIP_ZERO_NEUTRAL);
                continue;
            }
            double target = boundedStep(band.currentWeight(), neutral, Math.signum(test.zScore()));
            if (target == band.currentWeight()) {
                skipped.put(component, SKIP_AT_BOUND);
                continue;
            }
            String reason = test.zScore() > 0 ? "significant_outperformance" : "significant_underperformance";
            adjustments.add(new WeightAdjustment(component, band.currentWeight(), target, neutral,
                    band.sampleCount(), test.winRate(), test.zScore(), reason));
            changes.put(component, band.withWeight(target, now));
        }

        WeightSnapshot committed = weightStore.commit(changes);
        int folded = pendingSampleCount();
        pendingSamples.clear();

        LearningCycleResult result = new LearningCycleResult(committed.version(), now, adjustments, skipped);
        metricsService.recordWeightAdjustments(adjustments.size(), committed.version());
        writeUpdate(result, folded);
        if (result.adjusted()) {
            log.info("Weight learning cycle version={} adjusted={}", committed.version(),
                    adjustments.stream().map(a -> a.component() + ":" + a.oldWeight() + "->" + a.newWeight())
                            .toList());
        } else {
            log.debug("Weight learning cycle version={} no adjustments, {} samples folded", committed.version(),
                    folded);
        }
        return result;
    }

    /**
     * One step of {@code stepFraction * |neutral|} in the direction of {@code sign}, clamped to
     * {@code neutral +/- maxDrift * |neutral|}.
     */
    double boundedStep(double current, double neutral, double sign) {
        double scale = Math.abs(neutral);
        double step = learningProperties.getStepFraction() * scale;
        double lower = neutral - learningProperties.getMaxDrift() * scale;
        double upper = neutral + learningProperties.getMaxDrift() * scale;
        double target = current + sign * step;
        return Math.max(lower, Math.min(upper, target));
    }

    private int attribute(Map<String, Double> components, boolean win) {
        int attributed = 0;
        for (String component : new TreeSet<>(components.keySet())) {
            Double value = components.get(component);
            if (value == null || !Double.isFinite(value) || value == 0.0) {
                continue;
            }
            String canonical = CanonicalComponent.resolve(component)
                    .map(CanonicalComponent::canonicalName)
                    .orElse(CanonicalComponent.normalize(component));
            long[] counts = pendingSamples.computeIfAbsent(canonical, c -> new long[2]);
            counts[win ? 0 : 1]++;
            attributed++;
        }
        return attributed;
    }

    private void writeUpdate(LearningCycleResult result, int folded) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("version", result.version());
        record.put("ran_at", result.ranAt().toString());
        record.put("samples_folded", folded);
        record.put("min_samples", effectiveMinSamples());
        record.put("adjustments", result.adjustments());
        record.put("skipped", result.skipped());
        try {
            eventWriter.append(EventType.WEIGHT_UPDATE, record);
        } catch (RuntimeException e) {
            log.error("Failed to log weight update version={}", result.version(), e);
        }
    }
}

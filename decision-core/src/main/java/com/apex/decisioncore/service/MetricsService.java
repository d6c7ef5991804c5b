package com.apex.decisioncore.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, AtomicLong> blocksByReason = new ConcurrentHashMap<>();
    private final AtomicLong pendingShadowIntents = new AtomicLong();
    private final AtomicLong weightVersion = new AtomicLong();

    private Counter decisionsEnteredCounter;
    private Counter decisionsBlockedCounter;
    private Counter invalidTracesCounter;
    private Counter shadowOutcomesCounter;
    private Counter shadowDeferredCounter;
    private Counter weightAdjustmentsCounter;
    private Counter coercedInputsCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        decisionsEnteredCounter = Counter.builder("decisions_total").tag("outcome", "entered").register(meterRegistry);
        decisionsBlockedCounter = Counter.builder("decisions_total").tag("outcome", "blocked").register(meterRegistry);
        invalidTracesCounter = Counter.builder("decision_traces_invalid_total").register(meterRegistry);
        shadowOutcomesCounter = Counter.builder("shadow_outcomes_total").register(meterRegistry);
        shadowDeferredCounter = Counter.builder("shadow_horizons_deferred_total").register(meterRegistry);
        weightAdjustmentsCounter = Counter.builder("weight_adjustments_total").register(meterRegistry);
        coercedInputsCounter = Counter.builder("signal_inputs_coerced_total").register(meterRegistry);
        Gauge.builder("shadow_intents_pending", pendingShadowIntents, AtomicLong::get).register(meterRegistry);
        Gauge.builder("weight_store_version", weightVersion, AtomicLong::get).register(meterRegistry);
    }

    public void recordDecision(boolean entered, String blockReason) {
        if (entered) {
            increment(decisionsEnteredCounter);
            return;
        }
        increment(decisionsBlockedCounter);
        if (blockReason != null) {
            blocksByReason.computeIfAbsent(blockReason, reason -> new AtomicLong()).incrementAndGet();
            meterRegistry.counter("decisions_blocked_total", "reason", blockReason).increment();
        }
    }

    public void recordInvalidTrace() {
        increment(invalidTracesCounter);
    }

    public void recordCoercedInputs(int count) {
        if (count > 0 && coercedInputsCounter != null) {
            coercedInputsCounter.increment(count);
        }
    }

    public void recordShadowOutcomes(int count) {
        if (count > 0 && shadowOutcomesCounter != null) {
            shadowOutcomesCounter.increment(count);
        }
    }

    public void recordShadowDeferred() {
        increment(shadowDeferredCounter);
    }

    public void updatePendingShadowIntents(long pending) {
        pendingShadowIntents.set(pending);
    }

    public void recordWeightAdjustments(int count, long version) {
        weightVersion.set(version);
        if (count > 0 && weightAdjustmentsCounter != null) {
            weightAdjustmentsCounter.increment(count);
        }
    }

    public void recordHealthCheck(String check, String status) {
        meterRegistry.counter("health_checks_total", "check", check, "status", status).increment();
    }

    public void recordRemediation(String check, boolean succeeded) {
        meterRegistry.counter("health_remediations_total", "check", check,
                "result", succeeded ? "success" : "failure").increment();
    }

    public void recordTaskFailure(String task) {
        meterRegistry.counter("supervised_task_failures_total", "task", task).increment();
    }

    public Map<String, Long> getBlocksByReason() {
        Map<String, Long> snapshot = new ConcurrentHashMap<>();
        blocksByReason.forEach((reason, count) -> snapshot.put(reason, count.get()));
        return snapshot;
    }

    private void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}

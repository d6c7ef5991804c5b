package com.apex.decisioncore.shadow;

import com.apex.decisioncore.config.ShadowProperties;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.telemetry.EventType;
import com.apex.decisioncore.telemetry.JsonlEventWriter;
import com.apex.decisioncore.trading.pipeline.Direction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores blocked and taken decisions against hold-to-horizon and a take-profit x stop-loss grid, using
 * only the high, low and close of the realised window.
 */
@Service
@Slf4j
public class ShadowCounterfactualEvaluator {

    private final ShadowIntentStore store;
    private final PriceHistoryProvider priceHistoryProvider;
    private final JsonlEventWriter eventWriter;
    private final ShadowProperties shadowProperties;
    private final MetricsService metricsService;
    private final ObjectProvider<ShadowOutcomeListener> listeners;
    private final Clock clock;

    public ShadowCounterfactualEvaluator(ShadowIntentStore store, PriceHistoryProvider priceHistoryProvider,
                                         JsonlEventWriter eventWriter, ShadowProperties shadowProperties,
                                         MetricsService metricsService,
                                         ObjectProvider<ShadowOutcomeListener> listeners, Clock clock) {
        this.store = store;
        this.priceHistoryProvider = priceHistoryProvider;
        this.eventWriter = eventWriter;
        this.shadowProperties = shadowProperties;
        this.metricsService = metricsService;
        this.listeners = listeners;
        this.clock = clock;
    }

    public record PassSummary(int processed, int evaluatedHorizons, int outcomes, int deferred, int archived) {}

    /**
     * Registers a shadow intent for a decision. Returns the intent id, or empty when nothing was
     * enqueued (shadowing disabled, no usable entry price, no direction, or a duplicate id).
     */
    public Optional<String> enqueue(String symbol, Instant entryTs, Double entryPrice, Direction direction,
                                    ShadowKind kind, double score, String reason, Map<String, Double> components) {
        if (!shadowProperties.isEnabled()) {
            return Optional.empty();
        }
        if (entryPrice == null || !Double.isFinite(entryPrice) || entryPrice <= 0) {
            log.warn("Skipping shadow intent for {}: no usable decision price", symbol);
            return Optional.empty();
        }
        if (direction == null || direction == Direction.NEUTRAL) {
            log.debug("Skipping shadow intent for {}: neutral direction", symbol);
            return Optional.empty();
        }
        String intentId = ShadowIntent.idFor(symbol, kind, entryTs);
        ShadowIntent intent = new ShadowIntent(intentId, symbol, entryTs, entryPrice, direction, kind,
                shadowProperties.getHorizonsMin(), List.of(), score, reason, components);
        if (!store.enqueue(intent)) {
            log.debug("Shadow intent {} already known, ignoring", intentId);
            return Optional.empty();
        }
        try {
            eventWriter.append(EventType.SHADOW_INTENT, intent);
        } catch (RuntimeException e) {
            log.error("Failed to log shadow intent {}", intentId, e);
        }
        store.persist();
        metricsService.updatePendingShadowIntents(store.pendingCount());
        return Optional.of(intentId);
    }

    /**
     * One pass over all pending intents. Per intent, due horizons are scored in ascending order; the first
     * horizon without price data stops that intent until the next pass.
     */
    public PassSummary evaluatePending() {
        Instant now = clock.instant();
        int processed = 0;
        int evaluatedHorizons = 0;
        int outcomeCount = 0;
        int deferred = 0;
        int archivedCount = 0;
        boolean changed = false;

        for (ShadowIntent intent : store.pending()) {
            processed++;
            Optional<Integer> due = intent.nextDue(now);
            while (due.isPresent()) {
                int horizon = due.get();
                Optional<PricePath> path = fetchPath(intent, horizon);
                if (path.isEmpty()) {
                    deferred++;
                    metricsService.recordShadowDeferred();
                    break;
                }
                if (!store.markEvaluated(intent.intentId(), horizon)) {
                    break;
                }
                changed = true;
                evaluatedHorizons++;
                List<ShadowOutcome> outcomes = scoreHorizon(intent, horizon, path.get(), now);
                outcomeCount += outcomes.size();
                emit(intent, outcomes);
                intent = store.get(intent.intentId()).orElse(intent.withEvaluated(horizon));
                due = intent.nextDue(now);
            }
            if (intent.complete() && store.archive(intent.intentId()).isPresent()) {
                changed = true;
                archivedCount++;
                logArchived(intent);
            }
        }

        if (changed) {
            store.persist();
        }
        metricsService.recordShadowOutcomes(outcomeCount);
        metricsService.updatePendingShadowIntents(store.pendingCount());
        if (evaluatedHorizons > 0 || deferred > 0) {
            log.info("Shadow pass processed={} horizons={} outcomes={} deferred={} archived={}",
                    processed, evaluatedHorizons, outcomeCount, deferred, archivedCount);
        }
        return new PassSummary(processed, evaluatedHorizons, outcomeCount, deferred, archivedCount);
    }

    /**
     * Baseline plus one outcome per grid cell, two when both levels were touched.
     */
    public List<ShadowOutcome> scoreHorizon(ShadowIntent intent, int horizon, PricePath path, Instant evaluatedAt) {
        double entry = intent.entryPrice();
        boolean bullish = intent.direction() != Direction.BEARISH;
        double baselineReturn = returnPct(entry, path.close(), bullish);

        List<ShadowOutcome> outcomes = new ArrayList<>();
        outcomes.add(outcome(intent, horizon, path, baselineReturn, ShadowOutcome.BASELINE_VARIANT,
                null, null, false, false, false, evaluatedAt));

        for (Double tp : shadowProperties.getTpPcts()) {
            for (Double sl : shadowProperties.getSlPcts()) {
                boolean hitTp;
                boolean hitSl;
                if (bullish) {
                    hitTp = path.high() >= entry * (1.0 + tp / 100.0);
                    hitSl = path.low() <= entry * (1.0 - sl / 100.0);
                } else {
                    hitTp = path.low() <= entry * (1.0 - tp / 100.0);
                    hitSl = path.high() >= entry * (1.0 + sl / 100.0);
                }
                String variant = variantName(tp, sl);
                if (hitTp && hitSl) {
                    outcomes.add(outcome(intent, horizon, path, tp, variant + "_best", tp, sl,
                            true, true, true, evaluatedAt));
                    outcomes.add(outcome(intent, horizon, path, -sl, variant + "_worst", tp, sl,
                            true, true, true, evaluatedAt));
                } else if (hitTp) {
                    outcomes.add(outcome(intent, horizon, path, tp, variant, tp, sl,
                            true, false, false, evaluatedAt));
                } else if (hitSl) {
                    outcomes.add(outcome(intent, horizon, path, -sl, variant, tp, sl,
                            false, true, false, evaluatedAt));
                } else {
                    outcomes.add(outcome(intent, horizon, path, baselineReturn, variant, tp, sl,
                            false, false, false, evaluatedAt));
                }
            }
        }
        return outcomes;
    }

    static String variantName(double tpPct, double slPct) {
        return "tp" + plain(tpPct) + "_sl" + plain(slPct);
    }

    static double returnPct(double entry, double exit, boolean bullish) {
        if (entry <= 0) {
            return 0.0;
        }
        double r = (exit / entry - 1.0) * 100.0;
        return bullish ? r : -r;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private Optional<PricePath> fetchPath(ShadowIntent intent, int horizon) {
        try {
            Optional<PricePath> path = priceHistoryProvider.pricePath(intent.symbol(), intent.entryTs(),
                    intent.dueAt(horizon));
            if (path == null || path.isEmpty()) {
                log.debug("No price data yet for {} horizon={}m", intent.intentId(), horizon);
                return Optional.empty();
            }
            if (!path.get().usable()) {
                log.warn("Unusable price path for {} horizon={}m: {}", intent.intentId(), horizon, path.get());
                return Optional.empty();
            }
            return path;
        } catch (RuntimeException e) {
            log.warn("Price history unavailable for {} horizon={}m: {}", intent.intentId(), horizon, e.getMessage());
            return Optional.empty();
        }
    }

    private ShadowOutcome outcome(ShadowIntent intent, int horizon, PricePath path, double returnPct,
                                  String variant, Double tp, Double sl, boolean hitTp, boolean hitSl,
                                  boolean ambiguous, Instant evaluatedAt) {
        return new ShadowOutcome(intent.intentId(), intent.symbol(), intent.kind(), horizon, intent.entryPrice(),
                path.close(), returnPct, variant, tp, sl, hitTp, hitSl, ambiguous, path.high(), path.low(),
                evaluatedAt);
    }

    private void emit(ShadowIntent intent, List<ShadowOutcome> outcomes) {
        for (ShadowOutcome outcome : outcomes) {
            try {
                eventWriter.append(EventType.SHADOW_OUTCOME, outcome);
            } catch (RuntimeException e) {
                log.error("Failed to log shadow outcome {} {} {}m", outcome.intentId(), outcome.variant(),
                        outcome.horizonMin(), e);
            }
        }
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onShadowOutcomes(intent, outcomes);
            } catch (RuntimeException e) {
                log.error("Shadow outcome listener {} failed for {}", listener.getClass().getSimpleName(),
                        intent.intentId(), e);
            }
        });
    }

    private void logArchived(ShadowIntent intent) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("intent_id", intent.intentId());
        record.put("symbol", intent.symbol());
        record.put("kind", intent.kind().label());
        record.put("horizons", intent.horizons());
        try {
            eventWriter.append(EventType.SHADOW_ARCHIVED, record);
        } catch (RuntimeException e) {
            log.error("Failed to log archival of {}", intent.intentId(), e);
        }
    }
}

package com.apex.decisioncore.trading.pipeline;

import com.apex.decisioncore.learning.WeightStore;
import com.apex.decisioncore.service.DecisionActivityTracker;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.service.TradeCooldownService;
import com.apex.decisioncore.shadow.ShadowCounterfactualEvaluator;
import com.apex.decisioncore.shadow.ShadowKind;
import com.apex.decisioncore.trading.gate.DisplacementGate;
import com.apex.decisioncore.trading.gate.GateContext;
import com.apex.decisioncore.trading.gate.GatePipeline;
import com.apex.decisioncore.trading.trace.DecisionIntelligenceTrace;
import com.apex.decisioncore.trading.trace.DecisionOutcome;
import com.apex.decisioncore.trading.trace.DecisionTraceBuilder;
import com.apex.decisioncore.trading.trace.DecisionTracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate, gate, trace, emit, shadow: one candidate from signals to decision. The decision is fixed
 * once the gate pipeline returns; everything after it is explanatory and cannot change it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeDecisionPipelineService {

    private final SignalAggregator signalAggregator;
    private final WeightStore weightStore;
    private final GatePipeline gatePipeline;
    private final DisplacementGate displacementGate;
    private final DecisionTracer decisionTracer;
    private final ShadowCounterfactualEvaluator shadowEvaluator;
    private final TradeCooldownService tradeCooldownService;
    private final DecisionActivityTracker activityTracker;
    private final MetricsService metricsService;
    private final Clock clock;

    public DecisionResult evaluate(PipelineRequest request) {
        Instant now = request.timestamp() != null ? request.timestamp() : clock.instant();
        PortfolioSnapshot portfolio = request.portfolio() != null ? request.portfolio() : PortfolioSnapshot.empty(now);

        SignalScore score = signalAggregator.aggregate(request.components(), weightStore.snapshot());
        metricsService.recordCoercedInputs(score.coercedInputs().size());

        String cycleId = request.cycleId() != null ? request.cycleId() : UUID.randomUUID().toString();
        String intentId = cycleId + ":" + request.symbol();
        DecisionTraceBuilder builder = decisionTracer.begin(intentId, cycleId, request.symbol(), now, score);

        GateContext context = new GateContext(request, score, portfolio, now);
        GatePipeline.Verdict verdict = gatePipeline.run(context, builder);
        DecisionOutcome outcome = verdict.passed() ? DecisionOutcome.ENTERED : DecisionOutcome.BLOCKED;
        if (verdict.passed()) {
            builder.addSecondaryReason(verdict.displacedSymbol() != null
                    ? "displaces:" + verdict.displacedSymbol()
                    : "displacement_not_required");
        }

        DecisionIntelligenceTrace trace = decisionTracer.finalizeTrace(builder, outcome, verdict.primaryReason());
        decisionTracer.emit(trace);

        if (verdict.passed()) {
            tradeCooldownService.recordTrade(request.symbol());
            activityTracker.recordEntry(now);
            if (verdict.displacedSymbol() != null) {
                displacementGate.recordDisplacement(now);
            }
        }
        enqueueShadow(request, score, outcome, verdict.primaryReason(), now);
        metricsService.recordDecision(verdict.passed(), verdict.passed() ? null : verdict.primaryReason());

        log.info("Decision {} {} reason={} score={} direction={}", request.symbol(), outcome.label(),
                verdict.primaryReason(), String.format("%.3f", score.normalizedScore()), score.direction().label());
        return new DecisionResult(request.symbol(), intentId, outcome, verdict.primaryReason(),
                trace.finalDecision().secondaryReasons(), verdict.displacedSymbol(), score, trace);
    }

    private void enqueueShadow(PipelineRequest request, SignalScore score, DecisionOutcome outcome, String reason,
                               Instant now) {
        try {
            ShadowKind kind = outcome == DecisionOutcome.ENTERED ? ShadowKind.TAKEN : ShadowKind.BLOCKED;
            shadowEvaluator.enqueue(request.symbol(), now, request.price(), score.direction(), kind,
                    score.normalizedScore(), reason, score.componentValues());
        } catch (RuntimeException e) {
            log.error("Failed to enqueue shadow intent for {}", request.symbol(), e);
        }
    }
}

package com.apex.decisioncore.service;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.trading.pipeline.DecisionResult;
import com.apex.decisioncore.trading.pipeline.MarketContext;
import com.apex.decisioncore.trading.pipeline.PipelineRequest;
import com.apex.decisioncore.trading.pipeline.PortfolioSnapshot;
import com.apex.decisioncore.trading.pipeline.PositionSnapshotProvider;
import com.apex.decisioncore.trading.pipeline.SignalFeed;
import com.apex.decisioncore.trading.pipeline.SymbolSignals;
import com.apex.decisioncore.trading.pipeline.TradeDecisionPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One polling tick: a single position snapshot and market context are taken up front and every
 * candidate of the tick is decided against them.
 */
@Service
@Slf4j
public class DecisionCycleService {

    static final String MDC_CYCLE_ID = "cycleId";

    private final SignalFeed signalFeed;
    private final PositionSnapshotProvider positionSnapshotProvider;
    private final TradeDecisionPipelineService pipelineService;
    private final DecisionActivityTracker activityTracker;
    private final DecisionProperties decisionProperties;
    private final Executor tradingExecutor;
    private final Clock clock;

    public DecisionCycleService(SignalFeed signalFeed,
                                PositionSnapshotProvider positionSnapshotProvider,
                                TradeDecisionPipelineService pipelineService,
                                DecisionActivityTracker activityTracker,
                                DecisionProperties decisionProperties,
                                @Qualifier("tradingExecutor") Executor tradingExecutor,
                                Clock clock) {
        this.signalFeed = signalFeed;
        this.positionSnapshotProvider = positionSnapshotProvider;
        this.pipelineService = pipelineService;
        this.activityTracker = activityTracker;
        this.decisionProperties = decisionProperties;
        this.tradingExecutor = tradingExecutor;
        this.clock = clock;
    }

    public List<DecisionResult> runCycle() {
        String cycleId = UUID.randomUUID().toString();
        MDC.put(MDC_CYCLE_ID, cycleId);
        try {
            Instant now = clock.instant();
            PortfolioSnapshot portfolio = positionSnapshotProvider.snapshot();
            MarketContext market = signalFeed.marketContext();
            List<SymbolSignals> candidates = signalFeed.latest();
            activityTracker.recordCycle(now, candidates.size());

            List<PipelineRequest> requests = new ArrayList<>();
            for (SymbolSignals signals : candidates) {
                toRequest(cycleId, signals, portfolio, market, now).ifPresent(requests::add);
            }
            List<DecisionResult> results = decisionProperties.getCycle().getParallelism() <= 1
                    ? runSequential(requests)
                    : runParallel(cycleId, requests);
            long entered = results.stream().filter(DecisionResult::entered).count();
            log.info("Decision cycle candidates={} entered={} blocked={} positions={}",
                    candidates.size(), entered, results.size() - entered, portfolio.size());
            return results;
        } finally {
            MDC.remove(MDC_CYCLE_ID);
        }
    }

    private List<DecisionResult> runSequential(List<PipelineRequest> requests) {
        List<DecisionResult> results = new ArrayList<>();
        for (PipelineRequest request : requests) {
            evaluateSafely(request).ifPresent(results::add);
        }
        return results;
    }

    private List<DecisionResult> runParallel(String cycleId, List<PipelineRequest> requests) {
        List<CompletableFuture<Optional<DecisionResult>>> futures = new ArrayList<>();
        for (PipelineRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                MDC.put(MDC_CYCLE_ID, cycleId);
                try {
                    return evaluateSafely(request);
                } finally {
                    MDC.remove(MDC_CYCLE_ID);
                }
            }, tradingExecutor));
        }
        long timeoutMs = decisionProperties.getCycle().getPerSymbolTimeout().toMillis();
        List<DecisionResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get(timeoutMs, TimeUnit.MILLISECONDS).ifPresent(results::add);
            } catch (TimeoutException e) {
                log.error("Decision for {} timed out after {} ms", requests.get(i).symbol(), timeoutMs);
            } catch (ExecutionException e) {
                log.error("Decision for {} failed", requests.get(i).symbol(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Decision cycle interrupted");
                break;
            }
        }
        return results;
    }

    private Optional<PipelineRequest> toRequest(String cycleId, SymbolSignals signals, PortfolioSnapshot portfolio,
                                                MarketContext market, Instant now) {
        try {
            return Optional.of(new PipelineRequest(cycleId, signals.symbol(), signals.sector(), signals.price(),
                    signals.components(), portfolio, market, now));
        } catch (RuntimeException e) {
            log.error("Skipping malformed candidate {}", signals == null ? null : signals.symbol(), e);
            return Optional.empty();
        }
    }

    private Optional<DecisionResult> evaluateSafely(PipelineRequest request) {
        try {
            return Optional.of(pipelineService.evaluate(request));
        } catch (RuntimeException e) {
            log.error("Decision pipeline failed for {}", request.symbol(), e);
            return Optional.empty();
        }
    }
}

package com.apex.decisioncore.trading.pipeline;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.config.LearningProperties;
import com.apex.decisioncore.config.ShadowProperties;
import com.apex.decisioncore.config.StorageProperties;
import com.apex.decisioncore.learning.WeightStore;
import com.apex.decisioncore.service.CircuitBreaker;
import com.apex.decisioncore.service.DecisionActivityTracker;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.service.TradeCooldownService;
import com.apex.decisioncore.service.TradingWindowService;
import com.apex.decisioncore.shadow.PriceHistoryProvider;
import com.apex.decisioncore.shadow.ShadowCounterfactualEvaluator;
import com.apex.decisioncore.shadow.ShadowIntent;
import com.apex.decisioncore.shadow.ShadowIntentStore;
import com.apex.decisioncore.shadow.ShadowKind;
import com.apex.decisioncore.shadow.ShadowOutcomeListener;
import com.apex.decisioncore.telemetry.AtomicStateFile;
import com.apex.decisioncore.telemetry.JsonlEventWriter;
import com.apex.decisioncore.trading.gate.CapacityGate;
import com.apex.decisioncore.trading.gate.DirectionalGate;
import com.apex.decisioncore.trading.gate.DisplacementGate;
import com.apex.decisioncore.trading.gate.GatePipeline;
import com.apex.decisioncore.trading.gate.RiskGate;
import com.apex.decisioncore.trading.gate.ScoreGate;
import com.apex.decisioncore.trading.trace.DecisionOutcome;
import com.apex.decisioncore.trading.trace.DecisionTracer;
import com.apex.decisioncore.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TradeDecisionPipelineServiceTest {

    @TempDir
    Path tempDir;

    private DecisionProperties props;
    private ShadowIntentStore shadowStore;
    private TradeCooldownService cooldownService;
    private DecisionActivityTracker activityTracker;
    private TradeDecisionPipelineService pipelineService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        Clock clock = TestFixtures.fixedClock();
        props = new DecisionProperties();
        StorageProperties storage = TestFixtures.storage(tempDir);
        JsonlEventWriter writer = TestFixtures.eventWriter(tempDir, clock);
        AtomicStateFile stateFile = TestFixtures.stateFile(clock);
        MetricsService metrics = TestFixtures.metrics();

        WeightStore weightStore = new WeightStore(stateFile, storage, new LearningProperties(), clock);
        cooldownService = new TradeCooldownService(clock);
        ReflectionTestUtils.setField(cooldownService, "cooldownMinutes", 5L);
        DisplacementGate displacementGate = new DisplacementGate(props);
        GatePipeline gatePipeline = new GatePipeline(new ScoreGate(props), new CapacityGate(props),
                new RiskGate(props, new TradingWindowService(props), new CircuitBreaker(clock), cooldownService),
                displacementGate, new DirectionalGate(props));

        ShadowProperties shadowProps = new ShadowProperties();
        shadowStore = new ShadowIntentStore(stateFile, storage, shadowProps);
        ObjectProvider<ShadowOutcomeListener> listeners = mock(ObjectProvider.class);
        when(listeners.orderedStream()).thenAnswer(invocation -> Stream.empty());
        ShadowCounterfactualEvaluator shadowEvaluator = new ShadowCounterfactualEvaluator(shadowStore,
                mock(PriceHistoryProvider.class), writer, shadowProps, metrics, listeners, clock);

        activityTracker = new DecisionActivityTracker(clock);
        pipelineService = new TradeDecisionPipelineService(new DefaultSignalAggregator(props), weightStore,
                gatePipeline, displacementGate, new DecisionTracer(writer, props, metrics), shadowEvaluator,
                cooldownService, activityTracker, metrics, clock);
    }

    @Test
    void strongAlignedSignalsEnter() {
        DecisionResult result = pipelineService.evaluate(request("cycle-1", "TSLA", strongSignals(),
                PortfolioSnapshot.empty(TestFixtures.NOW)));

        assertThat(result.outcome()).isEqualTo(DecisionOutcome.ENTERED);
        assertThat(result.primaryReason()).isEqualTo("all_gates_passed");
        assertThat(result.secondaryReasons()).contains("displacement_not_required");
        assertThat(result.intentId()).isEqualTo("cycle-1:TSLA");
        assertThat(result.trace().valid()).isTrue();
        assertThat(result.trace().gates()).containsOnlyKeys("score_gate", "capacity_gate", "risk_gate",
                "displacement_gate", "directional_gate");
        assertThat(cooldownService.isInCooldown("TSLA", TestFixtures.NOW)).isTrue();
        assertThat(activityTracker.getLastEntryAt()).contains(TestFixtures.NOW);
        assertThat(shadowStore.pending()).singleElement()
                .satisfies(intent -> {
                    assertThat(intent.kind()).isEqualTo(ShadowKind.TAKEN);
                    assertThat(intent.components()).containsKeys("options_flow", "dark_pool");
                });
    }

    @Test
    void flowAndDarkPoolEnterWithTwoPopulatedLayers() {
        props.getGates().getScore().setMinScore(1.0);

        DecisionResult result = pipelineService.evaluate(request("cycle-1", "TSLA",
                List.of(SignalComponent.of("flow", 1.2), SignalComponent.of("dark_pool", 0.3)),
                PortfolioSnapshot.empty(TestFixtures.NOW)));

        assertThat(result.outcome()).isEqualTo(DecisionOutcome.ENTERED);
        assertThat(result.trace().valid()).isTrue();
        assertThat(result.trace().populatedLayerCount()).isGreaterThanOrEqualTo(2);
        assertThat(result.trace().signalLayers().get("flow_signals"))
                .extracting(FeatureContribution::feature)
                .contains("options_flow");
    }

    @Test
    void weakSignalsAreBlockedBelowMinimumScore() throws IOException {
        DecisionResult result = pipelineService.evaluate(request("cycle-1", "TSLA",
                List.of(SignalComponent.of("flow", 0.5), SignalComponent.of("dark_pool", 0.2)),
                PortfolioSnapshot.empty(TestFixtures.NOW)));

        assertThat(result.outcome()).isEqualTo(DecisionOutcome.BLOCKED);
        assertThat(result.primaryReason()).isEqualTo("score_below_min");
        assertThat(result.trace().gates()).containsOnlyKeys("score_gate");
        assertThat(Files.readAllLines(tempDir.resolve("logs/blocked_trades.jsonl"))).hasSize(1);
        assertThat(shadowStore.pending()).extracting(ShadowIntent::kind).containsExactly(ShadowKind.BLOCKED);
        assertThat(cooldownService.isInCooldown("TSLA", TestFixtures.NOW)).isFalse();
    }

    @Test
    void fullBookDisplacesWeakestSeasonedIncumbent() {
        props.getGates().getCapacity().setMaxPositions(2);
        PortfolioSnapshot fullBook = new PortfolioSnapshot(Map.of(
                "AAA", TestFixtures.held("AAA", Duration.ofHours(1), 0.5),
                "BBB", TestFixtures.held("BBB", Duration.ofHours(1), 3.0)), TestFixtures.NOW);

        DecisionResult result = pipelineService.evaluate(request("cycle-1", "TSLA", strongSignals(), fullBook));

        assertThat(result.entered()).isTrue();
        assertThat(result.displacedSymbol()).isEqualTo("AAA");
        assertThat(result.secondaryReasons()).contains("displaces:AAA");
    }

    @Test
    void enteredSymbolIsOnCooldownForTheNextCycle() {
        pipelineService.evaluate(request("cycle-1", "TSLA", strongSignals(), PortfolioSnapshot.empty(TestFixtures.NOW)));

        DecisionResult second = pipelineService.evaluate(request("cycle-2", "TSLA", strongSignals(),
                PortfolioSnapshot.empty(TestFixtures.NOW)));

        assertThat(second.primaryReason()).isEqualTo("symbol_on_cooldown");
    }

    @Test
    void emptyInputIsBlockedAndTraceIsFlaggedInvalid() {
        DecisionResult result = pipelineService.evaluate(request("cycle-1", "TSLA", List.of(),
                PortfolioSnapshot.empty(TestFixtures.NOW)));

        assertThat(result.primaryReason()).isEqualTo("score_below_min");
        assertThat(result.secondaryReasons()).contains("empty_input");
        assertThat(result.trace().valid()).isFalse();
        assertThat(shadowStore.pendingCount()).isZero();
    }

    @Test
    void missingPriceSkipsShadowButNotDecision() {
        PipelineRequest request = new PipelineRequest("cycle-1", "TSLA", null, null, strongSignals(),
                PortfolioSnapshot.empty(TestFixtures.NOW), null, TestFixtures.NOW);

        DecisionResult result = pipelineService.evaluate(request);

        assertThat(result.entered()).isTrue();
        assertThat(shadowStore.pendingCount()).isZero();
    }

    private List<SignalComponent> strongSignals() {
        return List.of(SignalComponent.of("flow", 3.0), SignalComponent.of("dark_pool", 1.0),
                SignalComponent.of("iv_rank", "0.5"));
    }

    private PipelineRequest request(String cycleId, String symbol, List<SignalComponent> components,
                                    PortfolioSnapshot portfolio) {
        return new PipelineRequest(cycleId, symbol, "tech", 250.0, components, portfolio, null, TestFixtures.NOW);
    }
}

package com.apex.decisioncore.trading.trace;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.service.MetricsService;
import com.apex.decisioncore.telemetry.JsonlEventWriter;
import com.apex.decisioncore.trading.gate.BlockReason;
import com.apex.decisioncore.trading.gate.GateResult;
import com.apex.decisioncore.trading.pipeline.SignalComponent;
import com.apex.decisioncore.trading.pipeline.SignalScore;
import com.apex.decisioncore.util.TestFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DecisionTracerTest {

    @TempDir
    Path tempDir;

    private DecisionProperties props;
    private MetricsService metricsService;
    private DecisionTracer tracer;

    @BeforeEach
    void setUp() {
        props = new DecisionProperties();
        metricsService = mock(MetricsService.class);
        JsonlEventWriter writer = TestFixtures.eventWriter(tempDir, TestFixtures.fixedClock());
        tracer = new DecisionTracer(writer, props, metricsService);
    }

    @Test
    void multiLayerTraceIsValid() {
        DecisionTraceBuilder builder = begin(TestFixtures.strongBullishScore());
        builder.addGate(GateResult.pass("score_gate", Map.of("score", 3.8)));

        DecisionIntelligenceTrace trace = tracer.finalizeTrace(builder, DecisionOutcome.ENTERED, "all_gates_passed");

        assertThat(trace.valid()).isTrue();
        assertThat(trace.validationErrors()).isEmpty();
        assertThat(trace.signalLayers()).containsOnlyKeys("flow_signals", "dark_pool_signals", "regime_signals",
                "volatility_signals", "other_signals");
        assertThat(trace.gates()).containsOnlyKeys("score_gate");
        verify(metricsService, never()).recordInvalidTrace();
    }

    @Test
    void singlePopulatedLayerIsFlaggedButDecisionIsKept() {
        SignalScore oneLayer = TestFixtures.score(SignalComponent.of("insider", 3.0),
                SignalComponent.of("congress", 1.0));
        DecisionTraceBuilder builder = begin(oneLayer);

        DecisionIntelligenceTrace trace = tracer.finalizeTrace(builder, DecisionOutcome.ENTERED, "all_gates_passed");

        assertThat(trace.valid()).isFalse();
        assertThat(trace.validationErrors()).anyMatch(error -> error.contains("signal_layers"));
        assertThat(trace.finalDecision().outcome()).isEqualTo(DecisionOutcome.ENTERED);
        verify(metricsService).recordInvalidTrace();
    }

    @Test
    void blockedWithoutPrimaryReasonIsInvalid() {
        DecisionIntelligenceTrace trace = tracer.finalizeTrace(begin(TestFixtures.strongBullishScore()),
                DecisionOutcome.BLOCKED, " ");

        assertThat(trace.valid()).isFalse();
        assertThat(trace.validationErrors()).contains("blocked decision without primary_reason");
    }

    @Test
    void oversizedTraceIsInvalid() {
        props.getTrace().setMaxSerializedBytes(200);

        DecisionIntelligenceTrace trace = tracer.finalizeTrace(begin(TestFixtures.strongBullishScore()),
                DecisionOutcome.ENTERED, "all_gates_passed");

        assertThat(trace.validationErrors()).anyMatch(error -> error.contains("exceeds cap of 200"));
    }

    @Test
    void gateCannotBeRecordedTwice() {
        DecisionTraceBuilder builder = begin(TestFixtures.strongBullishScore());
        builder.addGate(GateResult.pass("score_gate", Map.of()));

        assertThatThrownBy(() -> builder.addGate(GateResult.pass("score_gate", Map.of())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finalizedTraceRejectsMutation() {
        DecisionTraceBuilder builder = begin(TestFixtures.strongBullishScore());
        tracer.finalizeTrace(builder, DecisionOutcome.ENTERED, "all_gates_passed");

        assertThat(builder.isFinalized()).isTrue();
        assertThatThrownBy(() -> builder.addGate(GateResult.pass("capacity_gate", Map.of())))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.addSecondaryReason("late"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.finalizeDecision(DecisionOutcome.BLOCKED, "other"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void coercedAndEmptyInputsBecomeSecondaryReasons() {
        SignalScore coerced = TestFixtures.score(SignalComponent.of("options_flow", "bad"),
                SignalComponent.of("dark_pool", 1.0));

        DecisionIntelligenceTrace trace = tracer.finalizeTrace(begin(coerced), DecisionOutcome.BLOCKED,
                "score_below_min");
        DecisionIntelligenceTrace empty = tracer.finalizeTrace(begin(TestFixtures.score()), DecisionOutcome.BLOCKED,
                "score_below_min");

        assertThat(trace.finalDecision().secondaryReasons()).contains("input_coerced:options_flow");
        assertThat(empty.finalDecision().secondaryReasons()).contains("empty_input");
        assertThat(empty.emptyInput()).isTrue();
    }

    @Test
    void blockedTraceIsWrittenWithBlockedTradeRecord() throws IOException {
        DecisionTraceBuilder builder = begin(TestFixtures.strongBullishScore());
        builder.addGate(GateResult.pass("score_gate", Map.of()));
        builder.addGate(GateResult.block("capacity_gate", BlockReason.CAPACITY_FULL, Map.of("positions", 16)));
        DecisionIntelligenceTrace trace = tracer.finalizeTrace(builder, DecisionOutcome.BLOCKED, "capacity_full");

        tracer.emit(trace);

        List<String> traces = Files.readAllLines(tempDir.resolve("logs/decision_traces.jsonl"));
        List<String> blocked = Files.readAllLines(tempDir.resolve("logs/blocked_trades.jsonl"));
        assertThat(traces).hasSize(1);
        assertThat(blocked).hasSize(1);

        ObjectMapper mapper = TestFixtures.objectMapper();
        JsonNode record = mapper.readTree(traces.get(0));
        assertThat(record.get("event_type").asText()).isEqualTo("DECISION_TRACE");
        assertThat(record.path("final_decision").path("outcome").asText()).isEqualTo("blocked");
        assertThat(record.path("final_decision").path("primary_reason").asText()).isEqualTo("capacity_full");
        assertThat(record.path("gates").path("capacity_gate").path("reason").asText()).isEqualTo("capacity_full");
        assertThat(record.path("signal_layers").path("flow_signals").get(0).path("feature").asText())
                .isEqualTo("options_flow");

        JsonNode blockedRecord = mapper.readTree(blocked.get(0));
        assertThat(blockedRecord.get("reason").asText()).isEqualTo("capacity_full");
        assertThat(blockedRecord.get("direction").asText()).isEqualTo("bullish");
    }

    @Test
    void enteredTraceWritesNoBlockedTradeRecord() {
        DecisionIntelligenceTrace trace = tracer.finalizeTrace(begin(TestFixtures.strongBullishScore()),
                DecisionOutcome.ENTERED, "all_gates_passed");

        tracer.emit(trace);

        assertThat(tempDir.resolve("logs/decision_traces.jsonl")).exists();
        assertThat(tempDir.resolve("logs/blocked_trades.jsonl")).doesNotExist();
    }

    private DecisionTraceBuilder begin(SignalScore score) {
        return tracer.begin("cycle-1:TSLA", "cycle-1", "TSLA", TestFixtures.NOW, score);
    }
}

package com.apex.decisioncore.trading.gate;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.service.CircuitBreaker;
import com.apex.decisioncore.service.TradeCooldownService;
import com.apex.decisioncore.service.TradingWindowService;
import com.apex.decisioncore.trading.pipeline.Direction;
import com.apex.decisioncore.trading.pipeline.HeldPosition;
import com.apex.decisioncore.trading.pipeline.PipelineRequest;
import com.apex.decisioncore.trading.pipeline.PortfolioSnapshot;
import com.apex.decisioncore.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RiskGateTest {

    private DecisionProperties props;
    private CircuitBreaker circuitBreaker;
    private TradeCooldownService cooldownService;
    private RiskGate gate;

    @BeforeEach
    void setUp() {
        Clock clock = TestFixtures.fixedClock();
        props = new DecisionProperties();
        circuitBreaker = new CircuitBreaker(clock);
        cooldownService = new TradeCooldownService(clock);
        ReflectionTestUtils.setField(cooldownService, "cooldownMinutes", 5L);
        gate = new RiskGate(props, new TradingWindowService(props), circuitBreaker, cooldownService);
    }

    @Test
    void passesCleanCandidate() {
        GateResult result = gate.evaluate(context("TSLA", "tech", Map.of()));

        assertThat(result.passed()).isTrue();
    }

    @Test
    void blocksOutsideTradingWindow() {
        props.getTradingWindow().setEnabled(true);
        props.getTradingWindow().setTimezone("America/New_York");
        props.getTradingWindow().setWindows(List.of("09:35-10:00"));

        GateResult result = gate.evaluate(context("TSLA", null, Map.of()));

        assertThat(result.reason()).isEqualTo(BlockReason.MARKET_CLOSED);
    }

    @Test
    void blocksWhileCircuitBreakerEngaged() {
        circuitBreaker.engage("performance_degradation", TestFixtures.NOW.plus(Duration.ofHours(1)));

        GateResult result = gate.evaluate(context("TSLA", null, Map.of()));

        assertThat(result.reason()).isEqualTo(BlockReason.RISK_EXCEEDED);
        assertThat(result.details()).containsEntry("circuit_breaker", "performance_degradation");
    }

    @Test
    void blocksSymbolOnCooldown() {
        cooldownService.recordTrade("tsla");

        GateResult result = gate.evaluate(context("TSLA", null, Map.of()));

        assertThat(result.reason()).isEqualTo(BlockReason.SYMBOL_ON_COOLDOWN);
        assertThat(result.details()).containsEntry("cooldown_remaining_sec", 300L);
    }

    @Test
    void blocksSymbolAlreadyHeld() {
        GateResult result = gate.evaluate(context("TSLA", null,
                Map.of("TSLA", TestFixtures.held("TSLA", Duration.ofHours(1), 2.0))));

        assertThat(result.reason()).isEqualTo(BlockReason.SYMBOL_EXPOSURE_LIMIT);
    }

    @Test
    void blocksWhenSectorIsFull() {
        props.getGates().getRisk().setMaxPositionsPerSector(2);
        Map<String, HeldPosition> positions = Map.of(
                "AAPL", new HeldPosition("AAPL", TestFixtures.NOW, 1, Direction.BULLISH, 1.0, "tech"),
                "MSFT", new HeldPosition("MSFT", TestFixtures.NOW, 1, Direction.BULLISH, 1.0, "tech"),
                "XOM", new HeldPosition("XOM", TestFixtures.NOW, 1, Direction.BULLISH, 1.0, "energy"));

        assertThat(gate.evaluate(context("TSLA", "tech", positions)).reason())
                .isEqualTo(BlockReason.SECTOR_EXPOSURE_LIMIT);
        assertThat(gate.evaluate(context("CVX", "energy", positions)).passed()).isTrue();
    }

    private GateContext context(String symbol, String sector, Map<String, HeldPosition> positions) {
        PortfolioSnapshot portfolio = new PortfolioSnapshot(positions, TestFixtures.NOW);
        PipelineRequest request = new PipelineRequest("cycle-1", symbol, sector, 100.0, List.of(), portfolio, null,
                TestFixtures.NOW);
        return new GateContext(request, TestFixtures.strongBullishScore(), portfolio, TestFixtures.NOW);
    }
}

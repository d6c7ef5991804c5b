package com.apex.decisioncore.service;

import com.apex.decisioncore.learning.RealizedTradeOutcome;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * In-memory record of recent decision activity, read by the cadence and performance health checks.
 */
@Component
public class DecisionActivityTracker {

    private static final Duration CLOSED_TRADE_RETENTION = Duration.ofDays(30);

    private final Instant startedAt;
    private final Deque<RealizedTradeOutcome> closedTrades = new ArrayDeque<>();

    private volatile Instant lastCycleAt;
    private volatile Instant lastSignalsAt;
    private volatile Instant lastEntryAt;

    public DecisionActivityTracker(Clock clock) {
        this.startedAt = clock.instant();
    }

    public void recordCycle(Instant at, int symbolsWithSignals) {
        lastCycleAt = at;
        if (symbolsWithSignals > 0) {
            lastSignalsAt = at;
        }
    }

    public void recordEntry(Instant at) {
        lastEntryAt = at;
    }

    public synchronized void recordClosedTrade(RealizedTradeOutcome outcome) {
        if (outcome == null || outcome.closedAt() == null) {
            return;
        }
        closedTrades.addLast(outcome);
        Instant cutoff = outcome.closedAt().minus(CLOSED_TRADE_RETENTION);
        while (!closedTrades.isEmpty() && closedTrades.peekFirst().closedAt().isBefore(cutoff)) {
            closedTrades.pollFirst();
        }
    }

    public synchronized List<RealizedTradeOutcome> closedTradesSince(Instant since) {
        List<RealizedTradeOutcome> recent = new ArrayList<>();
        for (RealizedTradeOutcome outcome : closedTrades) {
            if (!outcome.closedAt().isBefore(since)) {
                recent.add(outcome);
            }
        }
        return recent;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getLastCycleAt() {
        return Optional.ofNullable(lastCycleAt);
    }

    public Optional<Instant> getLastSignalsAt() {
        return Optional.ofNullable(lastSignalsAt);
    }

    public Optional<Instant> getLastEntryAt() {
        return Optional.ofNullable(lastEntryAt);
    }
}

package com.apex.decisioncore.trading.trace;

import com.apex.decisioncore.trading.pipeline.Direction;

import java.time.Instant;

public record BlockedTradeRecord(
        Instant timestamp,
        String intentId,
        String symbol,
        String reason,
        double score,
        Direction direction
) {}

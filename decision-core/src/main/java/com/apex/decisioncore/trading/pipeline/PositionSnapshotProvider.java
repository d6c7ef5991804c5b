package com.apex.decisioncore.trading.pipeline;

import java.util.OptionalInt;

public interface PositionSnapshotProvider {

    /**
     * Current open positions. Must return a fresh immutable snapshot on every call.
     */
    PortfolioSnapshot snapshot();

    /**
     * Position count as reported directly by the broker, when available.
     */
    OptionalInt brokerPositionCount();
}

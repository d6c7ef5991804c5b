package com.apex.decisioncore.health;

import java.time.Instant;
import java.util.Optional;

public interface MarketDataFreshnessProvider {

    Optional<Instant> lastUpdate();

    /**
     * Asks the market-data side to refresh its cache. Returns without waiting for the refresh.
     */
    void requestRefresh();
}

package com.apex.decisioncore.shadow;

import java.time.Instant;
import java.util.Optional;

/**
 * Historical price access supplied by the market-data side. An empty result means the window is not
 * available yet; the caller retries on a later pass.
 */
public interface PriceHistoryProvider {

    Optional<PricePath> pricePath(String symbol, Instant from, Instant to);
}

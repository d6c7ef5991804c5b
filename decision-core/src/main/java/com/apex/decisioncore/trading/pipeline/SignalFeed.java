package com.apex.decisioncore.trading.pipeline;

import java.util.List;

/**
 * Enriched per-symbol signals and the market context of the current cycle, supplied by the enrichment
 * side. Called once per decision cycle.
 */
public interface SignalFeed {

    List<SymbolSignals> latest();

    MarketContext marketContext();
}

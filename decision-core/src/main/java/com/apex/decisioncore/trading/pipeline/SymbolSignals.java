package com.apex.decisioncore.trading.pipeline;

import java.util.List;

public record SymbolSignals(String symbol, String sector, Double price, List<SignalComponent> components) {
    public SymbolSignals {
        components = components == null ? List.of() : List.copyOf(components);
    }
}

package com.apex.decisioncore.trading.gate;

public interface Gate {

    String name();

    GateResult evaluate(GateContext context);
}

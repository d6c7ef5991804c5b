package com.apex.decisioncore.trading.pipeline;

/**
 * A contribution pulling against the cycle's overall direction.
 */
public record OpposingSignal(String name, String layer, double contribution, double magnitude) {}

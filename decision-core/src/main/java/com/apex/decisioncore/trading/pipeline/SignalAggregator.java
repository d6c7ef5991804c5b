package com.apex.decisioncore.trading.pipeline;

import com.apex.decisioncore.learning.WeightSnapshot;

import java.util.List;

public interface SignalAggregator {
    SignalScore aggregate(List<SignalComponent> components, WeightSnapshot weights);
}

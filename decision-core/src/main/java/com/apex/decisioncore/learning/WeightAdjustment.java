package com.apex.decisioncore.learning;

public record WeightAdjustment(
        String component,
        double oldWeight,
        double newWeight,
        double neutralWeight,
        long samples,
        double winRate,
        double zScore,
        String reason
) {}

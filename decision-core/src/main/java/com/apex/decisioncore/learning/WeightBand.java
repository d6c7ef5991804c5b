package com.apex.decisioncore.learning;

import java.time.Instant;

/**
 * Learned multiplier for one signal component. {@code sampleCount} always equals
 * {@code wins + losses} and never decreases.
 */
public record WeightBand(
        String componentName,
        double neutralWeight,
        double currentWeight,
        long sampleCount,
        long wins,
        long losses,
        Instant lastAdjustedAt
) {

    public static WeightBand neutral(String componentName, double neutralWeight) {
        return new WeightBand(componentName, neutralWeight, neutralWeight, 0, 0, 0, null);
    }

    public WeightBand withSamples(long addedWins, long addedLosses) {
        if (addedWins < 0 || addedLosses < 0) {
            throw new IllegalArgumentException("Sample increments must not be negative");
        }
        long newWins = wins + addedWins;
        long newLosses = losses + addedLosses;
        return new WeightBand(componentName, neutralWeight, currentWeight, newWins + newLosses,
                newWins, newLosses, lastAdjustedAt);
    }

    public WeightBand withWeight(double weight, Instant adjustedAt) {
        return new WeightBand(componentName, neutralWeight, weight, sampleCount, wins, losses, adjustedAt);
    }

    public double winRate() {
        return sampleCount == 0 ? Double.NaN : (double) wins / sampleCount;
    }

    public double driftFromNeutral() {
        if (neutralWeight == 0.0) {
            return 0.0;
        }
        return (currentWeight - neutralWeight) / Math.abs(neutralWeight);
    }
}

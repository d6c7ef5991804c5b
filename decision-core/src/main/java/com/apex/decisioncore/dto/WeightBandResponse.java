package com.apex.decisioncore.dto;

import com.apex.decisioncore.learning.WeightBand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightBandResponse {

    private String component;
    private double neutralWeight;
    private double currentWeight;
    private double driftPct;
    private long sampleCount;
    private long wins;
    private long losses;
    private Double winRate;
    private Instant lastAdjustedAt;

    public static WeightBandResponse from(WeightBand band) {
        double winRate = band.winRate();
        return WeightBandResponse.builder()
                .component(band.componentName())
                .neutralWeight(band.neutralWeight())
                .currentWeight(band.currentWeight())
                .driftPct(band.driftFromNeutral() * 100.0)
                .sampleCount(band.sampleCount())
                .wins(band.wins())
                .losses(band.losses())
                .winRate(Double.isNaN(winRate) ? null : winRate)
                .lastAdjustedAt(band.lastAdjustedAt())
                .build();
    }
}

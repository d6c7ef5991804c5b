package com.apex.decisioncore.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightSnapshotResponse {

    private long version;
    private Instant updatedAt;
    private List<WeightBandResponse> bands;
}

package com.apex.decisioncore.controller;

import com.apex.decisioncore.dto.WeightBandResponse;
import com.apex.decisioncore.dto.WeightSnapshotResponse;
import com.apex.decisioncore.exception.NotFoundException;
import com.apex.decisioncore.learning.WeightSnapshot;
import com.apex.decisioncore.learning.WeightStore;
import com.apex.decisioncore.trading.pipeline.CanonicalComponent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the learned weight bands for reporting.
 */
@RestController
@RequestMapping("/api/weights")
@RequiredArgsConstructor
@Tag(name = "Weights")
public class WeightBandController {

    private final WeightStore weightStore;

    @GetMapping
    @Operation(summary = "Current weight snapshot")
    public ResponseEntity<WeightSnapshotResponse> snapshot() {
        WeightSnapshot snapshot = weightStore.snapshot();
        return ResponseEntity.ok(WeightSnapshotResponse.builder()
                .version(snapshot.version())
                .updatedAt(snapshot.updatedAt())
                .bands(snapshot.bands().values().stream().map(WeightBandResponse::from).toList())
                .build());
    }

    @GetMapping("/{component}")
    @Operation(summary = "Weight band of one component, by canonical name or alias")
    public ResponseEntity<WeightBandResponse> band(@PathVariable String component) {
        String canonical = CanonicalComponent.resolve(component)
                .map(CanonicalComponent::canonicalName)
                .orElse(CanonicalComponent.normalize(component));
        return weightStore.band(canonical)
                .map(WeightBandResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("weight_band", component));
    }
}

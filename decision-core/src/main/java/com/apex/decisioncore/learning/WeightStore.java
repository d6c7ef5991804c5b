package com.apex.decisioncore.learning;

import com.apex.decisioncore.config.LearningProperties;
import com.apex.decisioncore.config.StorageProperties;
import com.apex.decisioncore.telemetry.AtomicStateFile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Versioned weight bands. Any thread may read; writes are package-private so only the learner commits.
 * A commit builds a complete new {@link WeightSnapshot} and swaps it in with one reference write.
 */
@Component
@Slf4j
public class WeightStore {

    static final String STATE_FILE = "signal_weights.json";

    private final AtomicReference<WeightSnapshot> current = new AtomicReference<>(WeightSnapshot.empty());
    private final AtomicStateFile stateFile;
    private final StorageProperties storageProperties;
    private final LearningProperties learningProperties;
    private final Clock clock;

    public WeightStore(AtomicStateFile stateFile, StorageProperties storageProperties,
                       LearningProperties learningProperties, Clock clock) {
        this.stateFile = stateFile;
        this.storageProperties = storageProperties;
        this.learningProperties = learningProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        WeightSnapshot loaded = stateFile.read(statePath(), WeightSnapshot.class).orElse(WeightSnapshot.empty());
        Map<String, WeightBand> bands = new HashMap<>(loaded.bands());
        learningProperties.getNeutralWeights().forEach((component, neutral) ->
                bands.computeIfAbsent(component, name -> WeightBand.neutral(name, neutral)));
        current.set(new WeightSnapshot(loaded.version(), bands, loaded.updatedAt()));
        log.info("Weight store loaded version={} bands={}", loaded.version(), bands.size());
    }

    public WeightSnapshot snapshot() {
        return current.get();
    }

    public double weightFor(String component) {
        return current.get().weightFor(component);
    }

    public Optional<WeightBand> band(String component) {
        return current.get().band(component);
    }

    /**
     * Applies {@code changes} on top of the current snapshot and publishes the result as the next
     * version. Sample counts are never allowed to go backwards.
     */
    synchronized WeightSnapshot commit(Map<String, WeightBand> changes) {
        WeightSnapshot base = current.get();
        if (changes.isEmpty()) {
            return base;
        }
        Map<String, WeightBand> bands = new HashMap<>(base.bands());
        changes.forEach((component, band) -> {
            WeightBand previous = bands.get(component);
            if (previous != null && band.sampleCount() < previous.sampleCount()) {
                throw new IllegalStateException("Sample count for " + component + " would decrease from "
                        + previous.sampleCount() + " to " + band.sampleCount());
            }
            bands.put(component, band);
        });
        WeightSnapshot next = new WeightSnapshot(base.version() + 1, bands, clock.instant());
        current.set(next);
        persist(next);
        return next;
    }

    private void persist(WeightSnapshot snapshot) {
        try {
            stateFile.write(statePath(), snapshot);
        } catch (RuntimeException e) {
            log.error("Failed to persist weight snapshot version={}, keeping in-memory state", snapshot.version(), e);
        }
    }

    private Path statePath() {
        return storageProperties.statePath(STATE_FILE);
    }
}

package com.apex.decisioncore.shadow;

import com.apex.decisioncore.config.ShadowProperties;
import com.apex.decisioncore.config.StorageProperties;
import com.apex.decisioncore.telemetry.AtomicStateFile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pending shadow intents. The decision cycle only inserts (insert-if-absent); the evaluator only
 * mutates existing entries. Each path is a single atomic map operation, so the two never need a
 * shared lock.
 */
@Component
@Slf4j
public class ShadowIntentStore {

    static final String STATE_FILE = "shadow_pending.json";

    public record PendingState(List<ShadowIntent> intents, List<String> archivedIds) {
        public PendingState {
            intents = intents == null ? List.of() : List.copyOf(intents);
            archivedIds = archivedIds == null ? List.of() : List.copyOf(archivedIds);
        }
    }

    private final ConcurrentHashMap<String, ShadowIntent> pending = new ConcurrentHashMap<>();
    private final Map<String, Boolean> archived;
    private final AtomicStateFile stateFile;
    private final StorageProperties storageProperties;

    public ShadowIntentStore(AtomicStateFile stateFile, StorageProperties storageProperties,
                             ShadowProperties shadowProperties) {
        this.stateFile = stateFile;
        this.storageProperties = storageProperties;
        int memory = shadowProperties.getArchivedIdMemory();
        this.archived = Collections.synchronizedMap(new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > memory;
            }
        });
    }

    @PostConstruct
    public void load() {
        stateFile.read(statePath(), PendingState.class).ifPresent(state -> {
            state.archivedIds().forEach(id -> archived.put(id, Boolean.TRUE));
            state.intents().forEach(intent -> pending.putIfAbsent(intent.intentId(), intent));
        });
        log.info("Shadow store loaded pending={} archived={}", pending.size(), archived.size());
    }

    /**
     * @return false when the id is already pending or was archived recently
     */
    public boolean enqueue(ShadowIntent intent) {
        if (archived.containsKey(intent.intentId())) {
            return false;
        }
        return pending.putIfAbsent(intent.intentId(), intent) == null;
    }

    /**
     * Marks {@code horizonMin} evaluated for the intent. Returns false if the intent is gone or the
     * horizon was already marked, in which case the caller must not emit outcomes for it.
     */
    public boolean markEvaluated(String intentId, int horizonMin) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        pending.computeIfPresent(intentId, (id, intent) -> {
            if (intent.isEvaluated(horizonMin)) {
                return intent;
            }
            claimed.set(true);
            return intent.withEvaluated(horizonMin);
        });
        return claimed.get();
    }

    /**
     * Removes a fully evaluated intent and remembers its id so it cannot be enqueued again.
     */
    public Optional<ShadowIntent> archive(String intentId) {
        ShadowIntent removed = pending.remove(intentId);
        if (removed != null) {
            archived.put(intentId, Boolean.TRUE);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ShadowIntent> get(String intentId) {
        return Optional.ofNullable(pending.get(intentId));
    }

    public List<ShadowIntent> pending() {
        List<ShadowIntent> intents = new ArrayList<>(pending.values());
        intents.sort(Comparator.comparing(ShadowIntent::entryTs).thenComparing(ShadowIntent::intentId));
        return intents;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean wasArchived(String intentId) {
        return archived.containsKey(intentId);
    }

    public synchronized void persist() {
        List<String> archivedIds;
        synchronized (archived) {
            archivedIds = new ArrayList<>(archived.keySet());
        }
        try {
            stateFile.write(statePath(), new PendingState(pending(), archivedIds));
        } catch (RuntimeException e) {
            log.error("Failed to persist shadow pending state ({} intents)", pending.size(), e);
        }
    }

    private Path statePath() {
        return storageProperties.statePath(STATE_FILE);
    }
}

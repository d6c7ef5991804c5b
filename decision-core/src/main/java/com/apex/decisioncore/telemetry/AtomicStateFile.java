package com.apex.decisioncore.telemetry;

import com.apex.decisioncore.exception.TradingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;

/**
 * Whole-file JSON state with replace-on-write: content goes to a sibling temp file which is then moved
 * over the target, so a reader sees either the previous or the new state.
 */
@Component
@Slf4j
public class AtomicStateFile {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AtomicStateFile(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    public void write(Path path, Object state) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("schema_version", EventType.SCHEMA_VERSION);
        envelope.put("saved_at", clock.instant().toString());
        envelope.set("state", objectMapper.valueToTree(state));
        Path temp = null;
        try {
            Path target = path.toAbsolutePath();
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), envelope);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TradingException("Failed to write state file " + path, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp state file {}", temp, e);
        }
    }

    /**
     * Reads the state stored at {@code path}. A missing or unknown schema version is tolerated with a
     * warning; only an unreadable file yields an empty result.
     */
    public <T> Optional<T> read(Path path, Class<T> type) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || !root.isObject()) {
                log.warn("State file {} is not a JSON object, ignoring", path);
                return Optional.empty();
            }
            JsonNode version = root.get("schema_version");
            if (version == null || !version.isInt()) {
                log.warn("State file {} has no schema_version, loading best-effort", path);
            } else if (version.asInt() != EventType.SCHEMA_VERSION) {
                log.warn("State file {} has schema_version {} (expected {}), loading best-effort",
                        path, version.asInt(), EventType.SCHEMA_VERSION);
            }
            JsonNode state = root.has("state") ? root.get("state") : root;
            return Optional.ofNullable(objectMapper.treeToValue(state, type));
        } catch (IOException e) {
            log.warn("Failed to read state file {}", path, e);
            return Optional.empty();
        }
    }
}

package com.apex.decisioncore.telemetry;

import com.apex.decisioncore.config.StorageProperties;
import com.apex.decisioncore.exception.TradingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Appends one JSON object per line to the log file of an {@link EventType}. Records are validated
 * against the type's required fields before anything touches the disk.
 */
@Component
@Slf4j
public class JsonlEventWriter {

    private final StorageProperties storageProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public JsonlEventWriter(StorageProperties storageProperties, ObjectMapper objectMapper, Clock clock) {
        this.storageProperties = storageProperties;
        this.objectMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    public ObjectNode toRecord(EventType type, Object payload) {
        JsonNode body = objectMapper.valueToTree(payload);
        if (body == null || !body.isObject()) {
            throw new EventContractViolation(type, type.requiredFields());
        }
        ObjectNode record = objectMapper.createObjectNode();
        record.put("schema_version", EventType.SCHEMA_VERSION);
        record.put("event_type", type.name());
        record.put("logged_at", clock.instant().toString());
        record.setAll((ObjectNode) body);

        List<String> missing = new ArrayList<>();
        for (String field : type.requiredFields()) {
            if (!record.hasNonNull(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new EventContractViolation(type, missing);
        }
        return record;
    }

    public void append(EventType type, Object payload) {
        ObjectNode record = toRecord(type, payload);
        String line;
        try {
            line = objectMapper.writeValueAsString(record) + "\n";
        } catch (JsonProcessingException e) {
            throw new TradingException("Failed to serialize " + type + " record", e);
        }
        Path path = storageProperties.logPath(type.fileName());
        Object lock = fileLocks.computeIfAbsent(path, p -> new Object());
        synchronized (lock) {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new TradingException("Failed to append " + type + " record to " + path, e);
            }
        }
        log.debug("Appended {} record to {}", type, path);
    }

    /**
     * Size in bytes of the JSON form of {@code payload}, as it would be written.
     */
    public int serializedSize(Object payload) {
        try {
            return objectMapper.writeValueAsBytes(payload).length;
        } catch (JsonProcessingException e) {
            throw new TradingException("Payload is not JSON-serializable", e);
        }
    }
}

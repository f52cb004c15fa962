package com.file.dedup.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * File-backed OperationRepository writing one JSON object per line in append mode.
 * Records already in the file, e.g. from earlier runs, are returned by the finders too.
 *
 * <p>Fields: {@code id}, {@code operation}, {@code source}, {@code destination},
 * {@code groupId}, {@code status}, {@code timestamp} (ISO-8601) and {@code message}.</p>
 */
public class JsonLinesOperationRepository implements OperationRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesOperationRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonLinesOperationRepository(Path file) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper();
    }

    public Path getFile() {
        return file;
    }

    /**
     * @throws UncheckedIOException if the line cannot be appended
     */
    @Override
    public synchronized OperationRecord save(OperationRecord record) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(serialize(record));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append operation record to " + file, e);
        }
        return record;
    }

    @Override
    public List<OperationRecord> findAll() {
        return readAll();
    }

    @Override
    public List<OperationRecord> findByGroupId(int groupId) {
        return filter(r -> r.groupId() == groupId);
    }

    @Override
    public List<OperationRecord> findByOperation(OperationType operation) {
        return filter(r -> r.operation() == operation);
    }

    @Override
    public List<OperationRecord> findByStatus(OperationStatus status) {
        return filter(r -> r.status() == status);
    }

    @Override
    public int count() {
        return readAll().size();
    }

    private List<OperationRecord> filter(Predicate<OperationRecord> predicate) {
        return readAll().stream().filter(predicate).toList();
    }

    private synchronized List<OperationRecord> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operation log " + file, e);
        }
        List<OperationRecord> records = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(deserialize(objectMapper.readTree(line)));
            } catch (JsonProcessingException | IllegalArgumentException | DateTimeException e) {
                log.warn("operationLog.skipMalformedLine file={} line={} error={}", file, lineNumber, e.getMessage());
            }
        }
        return records;
    }

    private String serialize(OperationRecord record) throws JsonProcessingException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", record.id());
        json.put("operation", record.operation().name());
        json.put("source", record.source().toString());
        json.put("destination", record.destination() != null ? record.destination().toString() : null);
        json.put("groupId", record.groupId());
        json.put("status", record.status().name());
        json.put("timestamp", record.timestamp().toString());
        json.put("message", record.message());
        return objectMapper.writeValueAsString(json);
    }

    private static OperationRecord deserialize(JsonNode node) {
        return OperationRecord.builder()
                .id(required(node, "id"))
                .operation(OperationType.valueOf(required(node, "operation")))
                .source(Path.of(required(node, "source")))
                .destination(textOrNull(node, "destination") != null ? Path.of(textOrNull(node, "destination")) : null)
                .groupId(node.path("groupId").asInt())
                .status(OperationStatus.valueOf(required(node, "status")))
                .timestamp(Instant.parse(required(node, "timestamp")))
                .message(textOrNull(node, "message"))
                .build();
    }

    private static String required(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

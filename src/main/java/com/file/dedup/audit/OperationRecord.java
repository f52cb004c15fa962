package com.file.dedup.audit;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one move, rollback or deletion.
 *
 * @param id          unique identifier
 * @param operation   what was attempted
 * @param source      the file operated on
 * @param destination where it was moved to, or null for deletions
 * @param groupId     the duplicate group the file belonged to
 * @param status      the outcome
 * @param timestamp   when the outcome was recorded
 * @param message     failure detail or free text, may be null
 */
public record OperationRecord(
        String id,
        OperationType operation,
        Path source,
        Path destination,
        int groupId,
        OperationStatus status,
        Instant timestamp,
        String message
) {
    public OperationRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private OperationType operation;
        private Path source;
        private Path destination;
        private int groupId;
        private OperationStatus status = OperationStatus.SUCCESS;
        private Instant timestamp = Instant.now();
        private String message;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder operation(OperationType operation) {
            this.operation = operation;
            return this;
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder destination(Path destination) {
            this.destination = destination;
            return this;
        }

        public Builder groupId(int groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder status(OperationStatus status) {
            this.status = status;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public OperationRecord build() {
            return new OperationRecord(id, operation, source, destination, groupId, status, timestamp, message);
        }
    }
}

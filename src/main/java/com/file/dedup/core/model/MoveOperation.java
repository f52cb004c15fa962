package com.file.dedup.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A planned relocation of one non-keeper file into the holding area.
 * Created in batch by the planner; the executed flag is the only mutable state.
 */
public class MoveOperation {
    private final Path source;
    private final Path destination;
    private final int groupId;
    private final Instant createdAt;
    private volatile boolean executed;

    public MoveOperation(Path source, Path destination, int groupId) {
        this(source, destination, groupId, Instant.now());
    }

    public MoveOperation(Path source, Path destination, int groupId, Instant createdAt) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.destination = Objects.requireNonNull(destination, "destination is required");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
        if (source.toAbsolutePath().normalize().equals(destination.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("source and destination are the same: " + source);
        }
        this.groupId = groupId;
    }

    public Path getSource() {
        return source;
    }

    public Path getDestination() {
        return destination;
    }

    public int getGroupId() {
        return groupId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isExecuted() {
        return executed;
    }

    /**
     * Marks the move as performed on disk.
     */
    public void markExecuted() {
        this.executed = true;
    }

    /**
     * Clears the executed flag after the move has been undone.
     */
    public void markRolledBack() {
        this.executed = false;
    }

    @Override
    public String toString() {
        return "MoveOperation{" + source + " -> " + destination +
                ", group=" + groupId +
                ", executed=" + executed + '}';
    }
}

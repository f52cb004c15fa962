package com.file.dedup.retention;

import com.file.dedup.core.model.FileRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of keeper selection for one group.
 *
 * @param keeper   the file that stays in place
 * @param removals every other candidate, in input order
 * @param reason   short description of what decided the keeper
 */
public record RetentionDecision(FileRecord keeper, List<FileRecord> removals, String reason) {

    public RetentionDecision {
        Objects.requireNonNull(keeper, "keeper is required");
        Objects.requireNonNull(reason, "reason is required");
        removals = List.copyOf(removals);
        if (removals.stream().anyMatch(r -> r.path().equals(keeper.path()))) {
            throw new IllegalArgumentException("keeper must not be selected for removal: " + keeper.path());
        }
    }

    public List<Path> removalPaths() {
        return removals.stream().map(FileRecord::path).toList();
    }
}

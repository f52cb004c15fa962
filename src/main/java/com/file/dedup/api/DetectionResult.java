package com.file.dedup.api;

import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.graph.SimilarityGraph;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a detection run.
 *
 * @param files  every admitted file, signed where signing succeeded, in lexical path order
 * @param graph  the populated similarity graph; consolidation keeps it current
 * @param groups duplicate groups at the time detection finished
 */
public record DetectionResult(List<FileRecord> files, SimilarityGraph graph, List<DuplicateGroup> groups) {

    public DetectionResult {
        files = List.copyOf(files);
        Objects.requireNonNull(graph, "graph is required");
        groups = List.copyOf(groups);
    }

    public boolean hasDuplicates() {
        return !groups.isEmpty();
    }

    public long signedCount() {
        return files.stream().filter(FileRecord::hasSignature).count();
    }

    /**
     * Number of files that belong to some group.
     */
    public int duplicateFileCount() {
        return groups.stream().mapToInt(DuplicateGroup::size).sum();
    }
}

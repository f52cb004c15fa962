package com.file.dedup.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A connected component of the similarity graph with at least two members.
 * Recomputed from the live graph on demand.
 *
 * @param id         stable identifier (smallest insertion sequence number among the members)
 * @param files      members in strictly increasing lexical order
 * @param similarity mean weight of all internal edges
 * @param edgeCount  number of internal edges
 */
public record DuplicateGroup(int id, List<Path> files, double similarity, int edgeCount) {

    public DuplicateGroup {
        Objects.requireNonNull(files, "files is required");
        if (files.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two files, got " + files.size());
        }
        List<Path> sorted = new ArrayList<>(files);
        sorted.sort(PathOrder.LEXICAL);
        Set<Path> seen = new HashSet<>();
        for (Path p : sorted) {
            if (!seen.add(p)) {
                throw new IllegalArgumentException("Duplicate member in group " + id + ": " + p);
            }
        }
        files = List.copyOf(sorted);
    }

    public int size() {
        return files.size();
    }

    public boolean contains(Path path) {
        return files.contains(path);
    }

    @Override
    public String toString() {
        return String.format("DuplicateGroup{id=%d, files=%d, similarity=%.4f}", id, files.size(), similarity);
    }
}

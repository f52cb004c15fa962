package com.file.dedup.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Undirected similarity relation between two files.
 * Endpoints are stored in lexical order so that {@code (a, b)} and {@code (b, a)} are the same edge.
 *
 * @param first     lexically smaller endpoint
 * @param second    lexically larger endpoint
 * @param weight    estimated similarity in [0, 1]
 * @param inherited true if the weight was propagated from a component representative
 *                  instead of being measured between these two files
 */
public record SimilarityEdge(Path first, Path second, double weight, boolean inherited) {

    public SimilarityEdge {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("Edge endpoints must be distinct: " + first);
        }
        if (weight < 0.0 || weight > 1.0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be between 0.0 and 1.0, got " + weight);
        }
        if (PathOrder.compare(first, second) > 0) {
            Path tmp = first;
            first = second;
            second = tmp;
        }
    }

    /**
     * Creates an edge measured directly between the two files.
     */
    public static SimilarityEdge measured(Path a, Path b, double weight) {
        return new SimilarityEdge(a, b, weight, false);
    }

    /**
     * Creates an edge whose weight was inherited from a representative comparison.
     */
    public static SimilarityEdge inherited(Path a, Path b, double weight) {
        return new SimilarityEdge(a, b, weight, true);
    }

    public boolean touches(Path path) {
        return first.equals(path) || second.equals(path);
    }

    /**
     * Returns the endpoint opposite to the given one.
     */
    public Path other(Path path) {
        if (first.equals(path)) {
            return second;
        }
        if (second.equals(path)) {
            return first;
        }
        throw new IllegalArgumentException(path + " is not an endpoint of " + this);
    }
}

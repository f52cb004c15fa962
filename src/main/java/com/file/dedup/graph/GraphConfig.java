package com.file.dedup.graph;

import java.util.Objects;

/**
 * Configuration for the similarity graph.
 *
 * @param threshold       minimum similarity (inclusive) for two files to be connected, in (0, 1]
 * @param edgeInheritance how matches against a component representative propagate
 */
public record GraphConfig(double threshold, EdgeInheritance edgeInheritance) {

    public static final double DEFAULT_THRESHOLD = 0.85;

    public GraphConfig {
        if (threshold <= 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be in (0.0, 1.0], got " + threshold);
        }
        Objects.requireNonNull(edgeInheritance, "edgeInheritance is required");
    }

    public static GraphConfig defaults() {
        return new GraphConfig(DEFAULT_THRESHOLD, EdgeInheritance.COMPONENT);
    }

    public static GraphConfig withThreshold(double threshold) {
        return new GraphConfig(threshold, EdgeInheritance.COMPONENT);
    }
}

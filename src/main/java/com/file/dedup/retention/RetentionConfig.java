package com.file.dedup.retention;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for keeper selection.
 *
 * @param strategy         criterion applied when no priority pattern decides
 * @param priorityPatterns glob patterns tried in declared order
 * @param priorityFirst    whether priority patterns are consulted before the strategy
 * @param baseDir          directory relative to which path lengths are measured, or null
 */
public record RetentionConfig(
        RetentionStrategy strategy,
        List<String> priorityPatterns,
        boolean priorityFirst,
        Path baseDir
) {
    public RetentionConfig {
        Objects.requireNonNull(strategy, "strategy is required");
        priorityPatterns = priorityPatterns == null ? List.of() : List.copyOf(priorityPatterns);
        for (String pattern : priorityPatterns) {
            if (pattern.isBlank()) {
                throw new IllegalArgumentException("priority patterns must not be blank");
            }
        }
        if (baseDir != null) {
            baseDir = baseDir.toAbsolutePath().normalize();
        }
    }

    /**
     * Keeps the newest file; no priority patterns.
     */
    public static RetentionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetentionStrategy strategy = RetentionStrategy.NEWEST;
        private final List<String> priorityPatterns = new ArrayList<>();
        private boolean priorityFirst = true;
        private Path baseDir;

        public Builder strategy(RetentionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * @throws InvalidStrategyException if the name is unknown
         */
        public Builder strategy(String name) {
            this.strategy = RetentionStrategy.fromName(name);
            return this;
        }

        public Builder priorityPattern(String pattern) {
            this.priorityPatterns.add(pattern);
            return this;
        }

        public Builder priorityPatterns(List<String> patterns) {
            this.priorityPatterns.clear();
            this.priorityPatterns.addAll(patterns);
            return this;
        }

        public Builder priorityFirst(boolean priorityFirst) {
            this.priorityFirst = priorityFirst;
            return this;
        }

        public Builder baseDir(Path baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        public RetentionConfig build() {
            return new RetentionConfig(strategy, priorityPatterns, priorityFirst, baseDir);
        }
    }
}

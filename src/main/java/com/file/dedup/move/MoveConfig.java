package com.file.dedup.move;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for relocating duplicates into the holding area.
 *
 * @param holdingDir          directory that receives moved duplicates
 * @param preserveStructure   whether destinations mirror the source layout relative to the base directory
 * @param perGroupDirectories whether each group gets its own {@code group_<id>} subdirectory
 * @param baseDir             base for relative layouts; when null the common ancestor of each group is used
 * @param dryRun              whether moves are only planned and reported
 */
public record MoveConfig(
        Path holdingDir,
        boolean preserveStructure,
        boolean perGroupDirectories,
        Path baseDir,
        boolean dryRun
) {
    public static final Path DEFAULT_HOLDING_DIR = Path.of("duplicates");

    public MoveConfig {
        Objects.requireNonNull(holdingDir, "holdingDir is required");
        holdingDir = holdingDir.toAbsolutePath().normalize();
        if (baseDir != null) {
            baseDir = baseDir.toAbsolutePath().normalize();
        }
    }

    public static MoveConfig defaults() {
        return builder().build();
    }

    public static MoveConfig forHoldingDir(Path holdingDir) {
        return builder().holdingDir(holdingDir).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path holdingDir = DEFAULT_HOLDING_DIR;
        private boolean preserveStructure = true;
        private boolean perGroupDirectories = false;
        private Path baseDir;
        private boolean dryRun = false;

        public Builder holdingDir(Path holdingDir) {
            this.holdingDir = holdingDir;
            return this;
        }

        public Builder preserveStructure(boolean preserveStructure) {
            this.preserveStructure = preserveStructure;
            return this;
        }

        public Builder perGroupDirectories(boolean perGroupDirectories) {
            this.perGroupDirectories = perGroupDirectories;
            return this;
        }

        public Builder baseDir(Path baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public MoveConfig build() {
            return new MoveConfig(holdingDir, preserveStructure, perGroupDirectories, baseDir, dryRun);
        }
    }
}

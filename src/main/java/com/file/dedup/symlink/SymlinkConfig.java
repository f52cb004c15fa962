package com.file.dedup.symlink;

import java.nio.file.Path;

/**
 * Configuration for symlink resolution.
 *
 * @param followSymlinks whether symlinks are followed at all
 * @param maxDepth       maximum number of link hops in one chain
 * @param boundary       directory every resolved link target must stay under, or null for no containment
 */
public record SymlinkConfig(boolean followSymlinks, int maxDepth, Path boundary) {

    public static final int DEFAULT_MAX_DEPTH = 10;

    public SymlinkConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0");
        }
        if (boundary != null) {
            boundary = boundary.toAbsolutePath().normalize();
        }
    }

    /**
     * Follows links up to {@value #DEFAULT_MAX_DEPTH} hops, no containment boundary.
     */
    public static SymlinkConfig defaults() {
        return new SymlinkConfig(true, DEFAULT_MAX_DEPTH, null);
    }

    /**
     * Never follows links; any symlink resolves to no result.
     */
    public static SymlinkConfig noFollow() {
        return new SymlinkConfig(false, DEFAULT_MAX_DEPTH, null);
    }

    public SymlinkConfig withMaxDepth(int maxDepth) {
        return new SymlinkConfig(followSymlinks, maxDepth, boundary);
    }

    public SymlinkConfig withBoundary(Path boundary) {
        return new SymlinkConfig(followSymlinks, maxDepth, boundary);
    }
}

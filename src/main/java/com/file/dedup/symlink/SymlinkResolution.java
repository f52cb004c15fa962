package com.file.dedup.symlink;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one path: either a target or a failure reason.
 *
 * @param source  the path that was resolved
 * @param target  the final non-link target, or null on failure
 * @param failure the failure reason, or null on success
 * @param hops    number of links followed
 */
public record SymlinkResolution(Path source, Path target, SymlinkFailure failure, int hops) {

    public SymlinkResolution {
        Objects.requireNonNull(source, "source is required");
        if ((target == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of target and failure must be set");
        }
    }

    public static SymlinkResolution resolved(Path source, Path target, int hops) {
        return new SymlinkResolution(source, target, null, hops);
    }

    public static SymlinkResolution failed(Path source, SymlinkFailure failure, int hops) {
        return new SymlinkResolution(source, null, failure, hops);
    }

    public boolean isResolved() {
        return target != null;
    }

    public Optional<Path> asOptional() {
        return Optional.ofNullable(target);
    }
}

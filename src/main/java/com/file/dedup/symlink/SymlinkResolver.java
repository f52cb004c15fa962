package com.file.dedup.symlink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves symlink chains one hop at a time with cycle, depth and containment checks.
 *
 * <p>The walk is an explicit loop over a visited set and a hop counter. Relative link
 * targets are resolved against the parent of the link that holds them, and the directories
 * of each target are resolved to their real location before the containment check, so a
 * target reached through a directory link is judged by where it really lives. Expected
 * filesystem conditions never raise: every failure becomes an empty result, and the
 * reason is only logged.</p>
 *
 * <p>Instances are stateless apart from their configuration and may be shared.</p>
 */
public class SymlinkResolver {
    private static final Logger log = LoggerFactory.getLogger(SymlinkResolver.class);

    private final SymlinkConfig config;

    public SymlinkResolver() {
        this(SymlinkConfig.defaults());
    }

    public SymlinkResolver(SymlinkConfig config) {
        this.config = config;
    }

    public SymlinkConfig getConfig() {
        return config;
    }

    /**
     * Resolves a path to its final target.
     *
     * @param path the path to resolve
     * @return the final target, or empty if the path cannot be resolved safely
     */
    public Optional<Path> resolve(Path path) {
        return resolveWithReason(path).asOptional();
    }

    /**
     * Resolves a path and reports why resolution failed, if it did.
     */
    public SymlinkResolution resolveWithReason(Path path) {
        SymlinkResolution resolution = walk(path.toAbsolutePath().normalize());
        if (!resolution.isResolved()) {
            log.debug("symlink.unresolved path={} reason={} hops={}",
                    path, resolution.failure(), resolution.hops());
        }
        return resolution;
    }

    private SymlinkResolution walk(Path start) {
        if (!Files.isSymbolicLink(start)) {
            return Files.exists(start, LinkOption.NOFOLLOW_LINKS)
                    ? SymlinkResolution.resolved(start, start, 0)
                    : SymlinkResolution.failed(start, SymlinkFailure.NOT_FOUND, 0);
        }
        if (!config.followSymlinks()) {
            return SymlinkResolution.failed(start, SymlinkFailure.NOT_FOLLOWED, 0);
        }

        Path boundary = null;
        if (config.boundary() != null) {
            try {
                boundary = config.boundary().toRealPath();
            } catch (IOException | SecurityException e) {
                log.debug("symlink.boundaryUnavailable boundary={} error={}", config.boundary(), e.getMessage());
                return SymlinkResolution.failed(start, SymlinkFailure.IO_ERROR, 0);
            }
        }

        Set<Path> visited = new HashSet<>();
        Path current = start;
        int hops = 0;
        while (true) {
            if (!visited.add(current)) {
                return SymlinkResolution.failed(start, SymlinkFailure.CIRCULAR_REFERENCE, hops);
            }
            if (!Files.isSymbolicLink(current)) {
                if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                    return SymlinkResolution.failed(start, SymlinkFailure.NOT_FOUND, hops);
                }
                return SymlinkResolution.resolved(start, current, hops);
            }
            if (hops >= config.maxDepth()) {
                return SymlinkResolution.failed(start, SymlinkFailure.DEPTH_EXCEEDED, hops);
            }

            Path target;
            try {
                target = Files.readSymbolicLink(current);
            } catch (IOException | SecurityException e) {
                log.debug("symlink.readFailed link={} error={}", current, e.getMessage());
                return SymlinkResolution.failed(start, SymlinkFailure.IO_ERROR, hops);
            }
            if (!target.isAbsolute()) {
                Path parent = current.getParent();
                target = parent != null ? parent.resolve(target) : target.toAbsolutePath();
            }

            try {
                target = canonicalParent(target);
            } catch (NoSuchFileException e) {
                return SymlinkResolution.failed(start, SymlinkFailure.NOT_FOUND, hops);
            } catch (IOException | SecurityException e) {
                log.debug("symlink.canonicalizeFailed target={} error={}", target, e.getMessage());
                return SymlinkResolution.failed(start, SymlinkFailure.IO_ERROR, hops);
            }

            if (boundary != null && !target.startsWith(boundary)) {
                return SymlinkResolution.failed(start, SymlinkFailure.CONTAINMENT_VIOLATION, hops);
            }

            hops++;
            current = target;
        }
    }

    /**
     * Resolves every directory component of a link target through the filesystem and keeps the
     * last component as is, so a further link in that position is still walked hop by hop.
     */
    static Path canonicalParent(Path target) throws IOException {
        Path name = target.getFileName();
        Path parent = target.getParent();
        if (name == null || parent == null || name.toString().equals(".") || name.toString().equals("..")) {
            return target.toRealPath();
        }
        return parent.toRealPath().resolve(name);
    }
}

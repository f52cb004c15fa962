package com.file.dedup.core.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A candidate file admitted by discovery.
 * The signature is attached later by the analyzer and may stay absent if signing fails.
 *
 * @param path         absolute, normalized path
 * @param size         size in bytes
 * @param modifiedTime last modification time
 * @param createdTime  creation time (falls back to modification time where the filesystem has none)
 * @param signature    MinHash signature, or null if not (yet) signed
 */
public record FileRecord(
        Path path,
        long size,
        Instant modifiedTime,
        Instant createdTime,
        Signature signature
) {
    public FileRecord {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(modifiedTime, "modifiedTime is required");
        Objects.requireNonNull(createdTime, "createdTime is required");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        path = path.toAbsolutePath().normalize();
    }

    /**
     * Reads size and timestamps of an existing file.
     */
    public static FileRecord fromPath(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileRecord(path, attrs.size(),
                attrs.lastModifiedTime().toInstant(),
                attrs.creationTime().toInstant(),
                null);
    }

    /**
     * Returns a copy of this record carrying the given signature.
     */
    public FileRecord withSignature(Signature signature) {
        return new FileRecord(path, size, modifiedTime, createdTime, signature);
    }

    public boolean hasSignature() {
        return signature != null;
    }

    public Optional<Signature> findSignature() {
        return Optional.ofNullable(signature);
    }

    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    @Override
    public String toString() {
        return path + " (" + size + " bytes, modified " + modifiedTime + ")";
    }
}

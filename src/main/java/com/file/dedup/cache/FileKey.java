package com.file.dedup.cache;

import com.file.dedup.core.model.FileRecord;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Identity of a file's content for caching: a changed size or modification time
 * makes a new key, so stale signatures are never served for rewritten files.
 */
public record FileKey(Path path, long size, Instant modifiedTime) {

    public FileKey {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(modifiedTime, "modifiedTime is required");
        path = path.toAbsolutePath().normalize();
    }

    public static FileKey of(FileRecord record) {
        return new FileKey(record.path(), record.size(), record.modifiedTime());
    }
}

package com.file.dedup.move;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem mutations used by consolidation. The seam exists so failures can be injected.
 */
public interface FileMover {

    /**
     * Returns the size of a file in bytes.
     */
    long size(Path file) throws IOException;

    /**
     * Creates a directory and its missing parents. Succeeds if it already exists.
     */
    void createDirectories(Path directory) throws IOException;

    /**
     * Moves a file. Never replaces an existing destination.
     */
    void move(Path source, Path destination) throws IOException;

    void delete(Path file) throws IOException;
}

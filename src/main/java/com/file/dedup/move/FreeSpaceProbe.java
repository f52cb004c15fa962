package com.file.dedup.move;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reports usable space for a destination directory.
 */
@FunctionalInterface
public interface FreeSpaceProbe {

    /**
     * Returns the bytes available to this process in the given directory.
     *
     * @param directory an existing directory
     */
    long usableSpace(Path directory) throws IOException;
}

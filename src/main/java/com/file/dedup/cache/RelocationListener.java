package com.file.dedup.cache;

import java.nio.file.Path;

/**
 * Listener for files leaving their original location. Implementations can react,
 * e.g., by invalidating cache entries.
 */
public interface RelocationListener {

    /**
     * Called after a file was moved or deleted.
     *
     * @param source      the original location
     * @param destination the new location, or null if the file was deleted
     */
    void onRelocated(Path source, Path destination);
}

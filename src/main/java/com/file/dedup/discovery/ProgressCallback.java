package com.file.dedup.discovery;

/**
 * Receives progress from scanning and signing.
 * Invoked on the calling thread; implementations should return quickly.
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NOOP = (processed, total, message) -> { };

    /**
     * @param processed files handled so far
     * @param total     files expected, or -1 while scanning
     * @param message   short human-readable status
     */
    void onProgress(long processed, long total, String message);
}

package com.file.dedup.cache;

/**
 * Configuration for the signature cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry, or 0 for no expiry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must be >= 0");
        }
    }

    /**
     * Default cache configuration: 100,000 entries, no expiry within a run, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(100_000, 0, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 0, false);
    }
}

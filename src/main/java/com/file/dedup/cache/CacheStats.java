package com.file.dedup.cache;

/**
 * Snapshot of signature cache activity.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that required signing
 * @param evictionCount signatures dropped by size or age limits
 * @param size          signatures currently held
 * @param trackedPaths  distinct paths with at least one cached signature
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size, long trackedPaths) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }

    /**
     * Share of lookups served from the cache, or 0 before any lookup.
     */
    public double hitRate() {
        long lookups = hitCount + missCount;
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }
}

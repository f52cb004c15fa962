package com.file.dedup.cache;

import com.file.dedup.core.model.Signature;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Cache of computed signatures keyed by file identity.
 * Owned by the caller and invalidated explicitly; nothing is cached implicitly.
 */
public interface SignatureCache {

    /**
     * Gets a cached signature.
     *
     * @param key the file identity
     * @return the cached signature, or empty if not cached
     */
    Optional<Signature> get(FileKey key);

    /**
     * Caches a signature.
     */
    void put(FileKey key, Signature signature);

    /**
     * Invalidates every entry for the given path, whatever its size or timestamp.
     *
     * @param path the file whose entries should be invalidated
     */
    void invalidate(Path path);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}

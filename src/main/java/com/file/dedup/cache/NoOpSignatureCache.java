package com.file.dedup.cache;

import com.file.dedup.core.model.Signature;

import java.nio.file.Path;
import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used as the default when caching is disabled.
 */
public class NoOpSignatureCache implements SignatureCache {

    @Override
    public Optional<Signature> get(FileKey key) {
        return Optional.empty();
    }

    @Override
    public void put(FileKey key, Signature signature) {
        // no-op
    }

    @Override
    public void invalidate(Path path) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

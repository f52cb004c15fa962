package com.file.dedup.cache;

import com.file.dedup.core.model.Signature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Caffeine-backed signature cache with a path index for targeted invalidation.
 * Implements {@link RelocationListener} to drop entries of moved or deleted files.
 */
public class CaffeineSignatureCache implements SignatureCache, RelocationListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSignatureCache.class);

    private final Cache<FileKey, Signature> cache;
    // Secondary index: path -> cache keys for that path (one per observed size/mtime)
    private final ConcurrentMap<Path, Set<FileKey>> pathIndex = new ConcurrentHashMap<>();

    public CaffeineSignatureCache(CacheConfig config) {
        this(config, ForkJoinPool.commonPool());
    }

    /**
     * @param executor runs removal notifications and maintenance
     */
    CaffeineSignatureCache(CacheConfig config, Executor executor) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .executor(executor)
                .removalListener((key, value, cause) -> {
                    if (cause != RemovalCause.REPLACED && key instanceof FileKey fk) {
                        removeFromIndex(fk);
                    }
                });
        if (config.ttlSeconds() > 0) {
            builder.expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()));
        }
        this.cache = builder.build();
        log.info("CaffeineSignatureCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Signature> get(FileKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(FileKey key, Signature signature) {
        cache.put(key, signature);
        pathIndex.compute(key.path(), (path, keys) -> {
            Set<FileKey> indexed = keys != null ? keys : ConcurrentHashMap.newKeySet();
            indexed.add(key);
            return indexed;
        });
    }

    @Override
    public void invalidate(Path path) {
        Set<FileKey> keys = pathIndex.remove(path.toAbsolutePath().normalize());
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cache entries for {}", keys.size(), path);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        pathIndex.clear();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize(),
                pathIndex.size()
        );
    }

    @Override
    public void onRelocated(Path source, Path destination) {
        invalidate(source);
        if (destination != null) {
            invalidate(destination);
        }
        log.debug("Cache invalidated for relocation: {} -> {}", source, destination);
    }

    /**
     * Runs pending evictions and removal notifications.
     */
    void cleanUp() {
        cache.cleanUp();
    }

    // Notifications arrive asynchronously; a key written again since its removal stays indexed.
    private void removeFromIndex(FileKey key) {
        pathIndex.computeIfPresent(key.path(), (path, keys) -> {
            if (cache.asMap().containsKey(key)) {
                return keys;
            }
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }
}

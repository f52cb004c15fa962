package com.file.dedup.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.files.scanned} (Counter)</li>
 *   <li>{@code dedup.files.skipped} (Counter, tag: reason)</li>
 *   <li>{@code dedup.signing.duration} (Timer)</li>
 *   <li>{@code dedup.files.signed} (Counter)</li>
 *   <li>{@code dedup.signing.failures} (Counter)</li>
 *   <li>{@code dedup.groups.found} (DistributionSummary, one sample per detection run)</li>
 *   <li>{@code dedup.similarity.score} (DistributionSummary)</li>
 *   <li>{@code dedup.moves.executed} (Counter)</li>
 *   <li>{@code dedup.moves.rolledback} (Counter)</li>
 *   <li>{@code dedup.files.deleted} (Counter)</li>
 *   <li>{@code dedup.cache.hit} and {@code dedup.cache.miss} (Counters)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> skippedCounters = new ConcurrentHashMap<>();
    private final Counter filesScanned;
    private final Timer signingDuration;
    private final Counter filesSigned;
    private final Counter signingFailures;
    private final DistributionSummary groupsFound;
    private final DistributionSummary similarityScore;
    private final Counter movesExecuted;
    private final Counter rollbacks;
    private final Counter deletes;
    private final Counter cacheHit;
    private final Counter cacheMiss;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.filesScanned = Counter.builder("dedup.files.scanned")
                .description("Number of candidate files admitted by discovery")
                .register(registry);
        this.signingDuration = Timer.builder("dedup.signing.duration")
                .description("Duration of signature computation per file")
                .register(registry);
        this.filesSigned = Counter.builder("dedup.files.signed")
                .description("Number of files signed")
                .register(registry);
        this.signingFailures = Counter.builder("dedup.signing.failures")
                .description("Number of files that could not be signed")
                .register(registry);
        this.groupsFound = DistributionSummary.builder("dedup.groups.found")
                .description("Number of duplicate groups found per detection run")
                .register(registry);
        this.similarityScore = DistributionSummary.builder("dedup.similarity.score")
                .description("Distribution of mean group similarity")
                .register(registry);
        this.movesExecuted = Counter.builder("dedup.moves.executed")
                .description("Number of files moved to the holding area")
                .register(registry);
        this.rollbacks = Counter.builder("dedup.moves.rolledback")
                .description("Number of moves undone after a batch failure")
                .register(registry);
        this.deletes = Counter.builder("dedup.files.deleted")
                .description("Number of duplicate files deleted")
                .register(registry);
        this.cacheHit = Counter.builder("dedup.cache.hit")
                .description("Number of signature cache hits")
                .register(registry);
        this.cacheMiss = Counter.builder("dedup.cache.miss")
                .description("Number of signature cache misses")
                .register(registry);
    }

    @Override
    public void incrementFilesScanned() {
        filesScanned.increment();
    }

    @Override
    public void incrementFilesSkipped(String reason) {
        Counter counter = skippedCounters.computeIfAbsent(reason, k ->
                Counter.builder("dedup.files.skipped")
                        .description("Number of files skipped during discovery")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSigningDuration(Duration duration) {
        signingDuration.record(duration);
    }

    @Override
    public void incrementFilesSigned() {
        filesSigned.increment();
    }

    @Override
    public void incrementSigningFailures() {
        signingFailures.increment();
    }

    @Override
    public void recordGroupsFound(int count) {
        groupsFound.record(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScore.record(score);
    }

    @Override
    public void incrementMovesExecuted() {
        movesExecuted.increment();
    }

    @Override
    public void incrementRollbacks() {
        rollbacks.increment();
    }

    @Override
    public void incrementDeletes() {
        deletes.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHit.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMiss.increment();
    }
}

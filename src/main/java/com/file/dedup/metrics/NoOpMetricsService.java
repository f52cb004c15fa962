package com.file.dedup.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementFilesScanned() {
    }

    @Override
    public void incrementFilesSkipped(String reason) {
    }

    @Override
    public void recordSigningDuration(Duration duration) {
    }

    @Override
    public void incrementFilesSigned() {
    }

    @Override
    public void incrementSigningFailures() {
    }

    @Override
    public void recordGroupsFound(int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementMovesExecuted() {
    }

    @Override
    public void incrementRollbacks() {
    }

    @Override
    public void incrementDeletes() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

package com.file.dedup.metrics;

import java.time.Duration;

/**
 * Interface for recording detection and consolidation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void incrementFilesScanned();

    void incrementFilesSkipped(String reason);

    void recordSigningDuration(Duration duration);

    void incrementFilesSigned();

    void incrementSigningFailures();

    void recordGroupsFound(int count);

    void recordSimilarityScore(double score);

    void incrementMovesExecuted();

    void incrementRollbacks();

    void incrementDeletes();

    void recordCacheHit();

    void recordCacheMiss();
}

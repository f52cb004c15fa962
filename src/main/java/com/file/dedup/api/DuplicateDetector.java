package com.file.dedup.api;

import com.file.dedup.cache.CaffeineSignatureCache;
import com.file.dedup.cache.NoOpSignatureCache;
import com.file.dedup.cache.SignatureCache;
import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.discovery.FileAnalyzer;
import com.file.dedup.discovery.FileScanner;
import com.file.dedup.discovery.ProgressCallback;
import com.file.dedup.graph.SimilarityGraph;
import com.file.dedup.logging.LogContext;
import com.file.dedup.metrics.MetricsService;
import com.file.dedup.metrics.NoOpMetricsService;
import com.file.dedup.signature.SignatureEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Main entry point for near-duplicate detection.
 * Runs discovery, signing and clustering and returns the duplicate groups.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (DuplicateDetector detector = DuplicateDetector.builder()
 *         .options(DetectionOptions.builder().threshold(0.9).build())
 *         .build()) {
 *     DetectionResult result = detector.detect(List.of(Path.of("notes")));
 *     for (DuplicateGroup group : result.groups()) {
 *         System.out.println(group);
 *     }
 * }
 * </pre>
 *
 * <p>The detector owns the signing worker pool; close it when done.</p>
 */
public class DuplicateDetector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final DetectionOptions options;
    private final SignatureEngine engine;
    private final SignatureCache cache;
    private final MetricsService metrics;
    private final FileScanner scanner;
    private final FileAnalyzer analyzer;

    private DuplicateDetector(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        if (builder.signatureCache != null) {
            this.cache = builder.signatureCache;
        } else if (options.getCacheConfig().enabled()) {
            this.cache = new CaffeineSignatureCache(options.getCacheConfig());
        } else {
            this.cache = new NoOpSignatureCache();
        }
        this.engine = new SignatureEngine(options.getSignatureConfig());
        this.scanner = new FileScanner(options.getScanConfig(), metrics);
        this.analyzer = new FileAnalyzer(engine, cache, metrics);
        log.info("DuplicateDetector initialized: threshold={}, numPermutations={}, shingleSize={}",
                options.getThreshold(), options.getSignatureConfig().numPermutations(),
                options.getSignatureConfig().shingleSize());
    }

    public DetectionOptions getOptions() {
        return options;
    }

    public SignatureCache getSignatureCache() {
        return cache;
    }

    public SignatureEngine getSignatureEngine() {
        return engine;
    }

    /**
     * Discovers candidate files.
     *
     * @throws IOException if a root does not exist or cannot be walked
     */
    public List<FileRecord> scan(Collection<Path> paths) throws IOException {
        return scanner.scan(paths);
    }

    /**
     * Signs the given files, leaving files that fail unsigned.
     */
    public List<FileRecord> analyze(List<FileRecord> files) {
        return analyzer.analyze(files);
    }

    /**
     * Builds a fresh similarity graph over the given files.
     */
    public SimilarityGraph buildGraph(List<FileRecord> files) {
        SimilarityGraph graph = new SimilarityGraph(options.getGraphConfig(), cache);
        graph.add(files);
        return graph;
    }

    public DetectionResult detect(Collection<Path> paths) throws IOException {
        return detect(paths, ProgressCallback.NOOP, () -> false);
    }

    /**
     * Runs the full detection pipeline.
     *
     * @param paths     files or directories to examine
     * @param callback  receives scanning and signing progress
     * @param cancelled polled between files
     * @throws IOException           if a root does not exist or cannot be walked
     * @throws CancellationException if cancelled or interrupted
     */
    public DetectionResult detect(Collection<Path> paths, ProgressCallback callback, BooleanSupplier cancelled)
            throws IOException {
        String scanId = LogContext.generateId();
        try (LogContext ctx = LogContext.forScan(scanId)) {
            log.info("detection.started paths={}", paths.size());
            List<FileRecord> found = scanner.scan(paths, callback, cancelled);
            List<FileRecord> signed = analyzer.analyze(found, callback, cancelled);
            SimilarityGraph graph = buildGraph(signed);
            List<DuplicateGroup> groups = graph.groups();

            metrics.recordGroupsFound(groups.size());
            for (DuplicateGroup group : groups) {
                metrics.recordSimilarityScore(group.similarity());
            }
            log.info("detection.completed files={} signed={} groups={}",
                    signed.size(), signed.stream().filter(FileRecord::hasSignature).count(), groups.size());
            return new DetectionResult(signed, graph, groups);
        }
    }

    @Override
    public void close() {
        engine.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DetectionOptions options = DetectionOptions.defaults();
        private SignatureCache signatureCache;
        private MetricsService metricsService;

        public Builder options(DetectionOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a caller-owned signature cache.
         * Defaults to a Caffeine cache sized by the options, or none if caching is disabled.
         */
        public Builder signatureCache(SignatureCache signatureCache) {
            this.signatureCache = signatureCache;
            return this;
        }

        /**
         * Sets a custom metrics service. Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public DuplicateDetector build() {
            if (options == null) {
                throw new IllegalStateException("DetectionOptions are required");
            }
            return new DuplicateDetector(this);
        }
    }
}

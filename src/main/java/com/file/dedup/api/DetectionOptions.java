package com.file.dedup.api;

import com.file.dedup.cache.CacheConfig;
import com.file.dedup.discovery.ScanConfig;
import com.file.dedup.graph.GraphConfig;
import com.file.dedup.move.MoveConfig;
import com.file.dedup.retention.RetentionConfig;
import com.file.dedup.signature.SignatureConfig;

import java.util.Objects;

/**
 * Options for a detection and consolidation run.
 * Aggregates the configuration of every stage of the pipeline.
 */
public class DetectionOptions {

    private static final double STRICT_THRESHOLD = 0.95;
    private static final double LENIENT_THRESHOLD = 0.70;

    private final ScanConfig scanConfig;
    private final SignatureConfig signatureConfig;
    private final GraphConfig graphConfig;
    private final RetentionConfig retentionConfig;
    private final MoveConfig moveConfig;
    private final CacheConfig cacheConfig;

    private DetectionOptions(Builder builder) {
        this.scanConfig = builder.scanConfig;
        this.signatureConfig = builder.signatureConfig;
        this.graphConfig = builder.graphConfig;
        this.retentionConfig = builder.retentionConfig;
        this.moveConfig = builder.moveConfig;
        this.cacheConfig = builder.cacheConfig;
    }

    public ScanConfig getScanConfig() {
        return scanConfig;
    }

    public SignatureConfig getSignatureConfig() {
        return signatureConfig;
    }

    public GraphConfig getGraphConfig() {
        return graphConfig;
    }

    public RetentionConfig getRetentionConfig() {
        return retentionConfig;
    }

    public MoveConfig getMoveConfig() {
        return moveConfig;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public double getThreshold() {
        return graphConfig.threshold();
    }

    /**
     * Creates default options.
     */
    public static DetectionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: near-identical files only, symlinks not followed.
     */
    public static DetectionOptions strict() {
        return builder()
                .threshold(STRICT_THRESHOLD)
                .scanConfig(ScanConfig.builder().followSymlinks(false).build())
                .build();
    }

    /**
     * Creates lenient options: looser threshold, any file extension.
     */
    public static DetectionOptions lenient() {
        return builder()
                .threshold(LENIENT_THRESHOLD)
                .scanConfig(ScanConfig.builder().anyExtension().build())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScanConfig scanConfig = ScanConfig.defaults();
        private SignatureConfig signatureConfig = SignatureConfig.defaults();
        private GraphConfig graphConfig = GraphConfig.defaults();
        private RetentionConfig retentionConfig = RetentionConfig.defaults();
        private MoveConfig moveConfig = MoveConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder scanConfig(ScanConfig scanConfig) {
            this.scanConfig = scanConfig;
            return this;
        }

        public Builder signatureConfig(SignatureConfig signatureConfig) {
            this.signatureConfig = signatureConfig;
            return this;
        }

        public Builder graphConfig(GraphConfig graphConfig) {
            this.graphConfig = graphConfig;
            return this;
        }

        /**
         * Sets the similarity threshold, keeping the configured edge inheritance.
         */
        public Builder threshold(double threshold) {
            this.graphConfig = new GraphConfig(threshold, graphConfig.edgeInheritance());
            return this;
        }

        public Builder retentionConfig(RetentionConfig retentionConfig) {
            this.retentionConfig = retentionConfig;
            return this;
        }

        public Builder moveConfig(MoveConfig moveConfig) {
            this.moveConfig = moveConfig;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public DetectionOptions build() {
            Objects.requireNonNull(scanConfig, "scanConfig is required");
            Objects.requireNonNull(signatureConfig, "signatureConfig is required");
            Objects.requireNonNull(graphConfig, "graphConfig is required");
            Objects.requireNonNull(retentionConfig, "retentionConfig is required");
            Objects.requireNonNull(moveConfig, "moveConfig is required");
            Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return new DetectionOptions(this);
        }
    }
}

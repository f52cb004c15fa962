package com.file.dedup.signature;

/**
 * Configuration for signature computation.
 *
 * @param numPermutations   sketch size N, one minimum per permutation function
 * @param shingleSize       shingle width k in characters
 * @param parallelThreshold normalized length above which extraction is chunked and parallel
 * @param chunkSize         characters per parallel chunk
 * @param workers           size of the worker pool used for chunked extraction
 * @param maxInMemoryBytes  files up to this size are read whole; bigger files are streamed
 * @param readBufferSize    byte chunk size when streaming a file
 */
public record SignatureConfig(
        int numPermutations,
        int shingleSize,
        int parallelThreshold,
        int chunkSize,
        int workers,
        long maxInMemoryBytes,
        int readBufferSize
) {
    public static final int DEFAULT_NUM_PERMUTATIONS = 128;
    public static final int DEFAULT_SHINGLE_SIZE = 5;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 1024 * 1024;
    public static final int DEFAULT_CHUNK_SIZE = 256 * 1024;
    public static final long DEFAULT_MAX_IN_MEMORY_BYTES = 64L * 1024 * 1024;
    public static final int DEFAULT_READ_BUFFER_SIZE = 8 * 1024;

    public SignatureConfig {
        if (numPermutations <= 0) {
            throw new IllegalArgumentException("numPermutations must be > 0");
        }
        if (shingleSize <= 0) {
            throw new IllegalArgumentException("shingleSize must be > 0");
        }
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException("parallelThreshold must be > 0");
        }
        if (chunkSize < 2 * shingleSize) {
            throw new IllegalArgumentException("chunkSize must be at least twice the shingle size");
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        if (maxInMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxInMemoryBytes must be > 0");
        }
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize must be > 0");
        }
    }

    /**
     * Default configuration: N=128, k=5, parallel above 1 MiB in 256 KiB chunks,
     * one worker per available processor.
     */
    public static SignatureConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int numPermutations = DEFAULT_NUM_PERMUTATIONS;
        private int shingleSize = DEFAULT_SHINGLE_SIZE;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int workers = Runtime.getRuntime().availableProcessors();
        private long maxInMemoryBytes = DEFAULT_MAX_IN_MEMORY_BYTES;
        private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;

        public Builder numPermutations(int numPermutations) {
            this.numPermutations = numPermutations;
            return this;
        }

        public Builder shingleSize(int shingleSize) {
            this.shingleSize = shingleSize;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder maxInMemoryBytes(long maxInMemoryBytes) {
            this.maxInMemoryBytes = maxInMemoryBytes;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public SignatureConfig build() {
            return new SignatureConfig(numPermutations, shingleSize, parallelThreshold,
                    chunkSize, workers, maxInMemoryBytes, readBufferSize);
        }
    }
}

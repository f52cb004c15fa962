package com.file.dedup.core.model;

import java.util.Arrays;

/**
 * MinHash sketch of a document's shingle set.
 * Holds one unsigned 32-bit minimum per permutation function, stored as {@code long}.
 *
 * <p>The estimated Jaccard similarity of two documents is the fraction of positions
 * at which their signatures agree.</p>
 */
public final class Signature {

    /**
     * Sentinel for a position that never saw a shingle.
     */
    public static final long MAX_HASH = 0xFFFFFFFFL;

    private final long[] values;

    private Signature(long[] values) {
        this.values = values;
    }

    /**
     * Creates a signature from the given minima. The array is copied.
     *
     * @throws IllegalArgumentException if the array is empty or holds values outside [0, MAX_HASH]
     */
    public static Signature of(long[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Signature must have at least one position");
        }
        for (long v : values) {
            if (v < 0 || v > MAX_HASH) {
                throw new IllegalArgumentException("Signature value out of range: " + v);
            }
        }
        return new Signature(values.clone());
    }

    /**
     * The signature of a document with no shingles: every position at {@link #MAX_HASH}.
     */
    public static Signature empty(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        long[] values = new long[size];
        Arrays.fill(values, MAX_HASH);
        return new Signature(values);
    }

    public int size() {
        return values.length;
    }

    public long get(int index) {
        return values[index];
    }

    public long[] toArray() {
        return values.clone();
    }

    /**
     * Returns true if no shingle contributed to this signature.
     */
    public boolean isEmpty() {
        for (long v : values) {
            if (v != MAX_HASH) {
                return false;
            }
        }
        return true;
    }

    /**
     * Estimated Jaccard similarity: the fraction of equal-valued positions.
     *
     * @throws IllegalArgumentException if the signatures differ in size
     */
    public double similarity(Signature other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException(
                    "Signatures must have same size: " + values.length + " vs " + other.values.length);
        }
        int matches = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == other.values[i]) {
                matches++;
            }
        }
        return (double) matches / values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Signature{size=" + values.length + ", empty=" + isEmpty() + '}';
    }
}

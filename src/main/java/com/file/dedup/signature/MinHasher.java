package com.file.dedup.signature;

import com.file.dedup.core.model.Signature;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Family of N hash permutations used for MinHash.
 *
 * <p>Each shingle is hashed once with 64-bit FNV-1a; permutation {@code i} then mixes
 * the base hash with its own seed through the SplitMix64 finalizer and keeps the high
 * 32 bits. Seeds come from a fixed master seed in order, so the first N permutations
 * are the same whatever the sketch size.</p>
 */
public final class MinHasher {

    private static final long MASTER_SEED = 0x5DEECE66DL;
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final long[] seeds;

    public MinHasher(int numPermutations) {
        if (numPermutations <= 0) {
            throw new IllegalArgumentException("numPermutations must be > 0");
        }
        SplittableRandom random = new SplittableRandom(MASTER_SEED);
        this.seeds = new long[numPermutations];
        for (int i = 0; i < numPermutations; i++) {
            seeds[i] = random.nextLong();
        }
    }

    public int size() {
        return seeds.length;
    }

    /**
     * Returns a fresh accumulator with every position at {@link Signature#MAX_HASH}.
     */
    public long[] newAccumulator() {
        long[] mins = new long[seeds.length];
        Arrays.fill(mins, Signature.MAX_HASH);
        return mins;
    }

    /**
     * 64-bit FNV-1a over the UTF-16 code units of {@code text[from, to)}.
     */
    public static long baseHash(CharSequence text, int from, int to) {
        long h = FNV_OFFSET;
        for (int i = from; i < to; i++) {
            h ^= text.charAt(i);
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * Applies permutation {@code index} to a base hash, yielding an unsigned 32-bit value.
     */
    public long permute(long baseHash, int index) {
        long z = baseHash ^ seeds[index];
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        z ^= (z >>> 31);
        return z >>> 32;
    }

    /**
     * Folds one shingle into the accumulator.
     */
    public void update(long[] mins, long baseHash) {
        for (int i = 0; i < seeds.length; i++) {
            long v = permute(baseHash, i);
            if (v < mins[i]) {
                mins[i] = v;
            }
        }
    }

    /**
     * Folds every k-shingle starting in {@code [from, to - k]} of the text into the accumulator.
     * Shingles that would run past {@code to} are left to the caller.
     */
    public void foldShingles(CharSequence text, int from, int to, int k, long[] mins) {
        for (int start = from; start + k <= to; start++) {
            update(mins, baseHash(text, start, start + k));
        }
    }

    /**
     * Element-wise minimum of {@code other} into {@code target}.
     */
    public static void merge(long[] target, long[] other) {
        for (int i = 0; i < target.length; i++) {
            if (other[i] < target[i]) {
                target[i] = other[i];
            }
        }
    }
}

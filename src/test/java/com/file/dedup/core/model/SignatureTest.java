package com.file.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignatureTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should reject empty and out-of-range values")
        void testRejectsInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> Signature.of(new long[0]));
            assertThrows(IllegalArgumentException.class, () -> Signature.of(new long[]{-1}));
            assertThrows(IllegalArgumentException.class, () -> Signature.of(new long[]{Signature.MAX_HASH + 1}));
        }

        @Test
        @DisplayName("Should copy the input array")
        void testCopiesValues() {
            long[] values = {1, 2, 3};
            Signature signature = Signature.of(values);
            values[0] = 99;
            assertEquals(1, signature.get(0));

            long[] out = signature.toArray();
            out[1] = 99;
            assertEquals(2, signature.get(1));
        }

        @Test
        @DisplayName("Empty signature has every position at MAX_HASH")
        void testEmpty() {
            Signature empty = Signature.empty(4);
            assertEquals(4, empty.size());
            assertTrue(empty.isEmpty());
            assertFalse(Signature.of(new long[]{1, Signature.MAX_HASH}).isEmpty());
        }
    }

    @Nested
    @DisplayName("Similarity")
    class SimilarityTests {

        @Test
        @DisplayName("Should count agreeing positions")
        void testFractionOfMatches() {
            Signature a = Signature.of(new long[]{1, 2, 3, 4});
            Signature b = Signature.of(new long[]{1, 2, 7, 8});
            assertEquals(0.5, a.similarity(b), 1e-9);
            assertEquals(0.5, b.similarity(a), 1e-9);
            assertEquals(1.0, a.similarity(a), 1e-9);
        }

        @Test
        @DisplayName("Should reject signatures of different sizes")
        void testSizeMismatch() {
            Signature a = Signature.of(new long[]{1, 2});
            Signature b = Signature.of(new long[]{1, 2, 3});
            assertThrows(IllegalArgumentException.class, () -> a.similarity(b));
        }

        @Test
        @DisplayName("Equal values means equal signatures")
        void testEquality() {
            assertEquals(Signature.of(new long[]{5, 6}), Signature.of(new long[]{5, 6}));
            assertEquals(Signature.of(new long[]{5, 6}).hashCode(), Signature.of(new long[]{5, 6}).hashCode());
            assertNotEquals(Signature.of(new long[]{5, 6}), Signature.of(new long[]{6, 5}));
        }
    }
}

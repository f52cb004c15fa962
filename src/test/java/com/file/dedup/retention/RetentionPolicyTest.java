package com.file.dedup.retention;

import com.file.dedup.core.model.FileRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static FileRecord file(String path, long size, long modifiedOffsetSeconds) {
        Instant modified = T0.plusSeconds(modifiedOffsetSeconds);
        return new FileRecord(Path.of(path), size, modified, T0, null);
    }

    private static RetentionPolicy policy(RetentionStrategy strategy) {
        return new RetentionPolicy(RetentionConfig.builder().strategy(strategy).build());
    }

    @Nested
    @DisplayName("Strategies")
    class StrategyTests {

        private final FileRecord old = file("/data/old.txt", 300, 10);
        private final FileRecord mid = file("/data/deep/nested/mid.txt", 100, 20);
        private final FileRecord recent = file("/data/x/recent.txt", 200, 30);
        private final List<FileRecord> group = List.of(old, mid, recent);

        @Test
        @DisplayName("Newest keeps the most recently modified file")
        void testNewest() {
            assertEquals(recent, policy(RetentionStrategy.NEWEST).selectKeeper(group));
        }

        @Test
        @DisplayName("Oldest keeps the least recently modified file")
        void testOldest() {
            assertEquals(old, policy(RetentionStrategy.OLDEST).selectKeeper(group));
        }

        @Test
        @DisplayName("Largest and smallest compare byte sizes")
        void testSize() {
            assertEquals(old, policy(RetentionStrategy.LARGEST).selectKeeper(group));
            assertEquals(mid, policy(RetentionStrategy.SMALLEST).selectKeeper(group));
        }

        @Test
        @DisplayName("Shortest relative path measures against the base directory")
        void testShortestPath() {
            RetentionPolicy withBase = new RetentionPolicy(RetentionConfig.builder()
                    .strategy(RetentionStrategy.SHORTEST_RELATIVE_PATH)
                    .baseDir(Path.of("/data"))
                    .build());
            assertEquals(old, withBase.selectKeeper(group));

            FileRecord outside = file("/o.txt", 1, 0);
            assertEquals(outside, withBase.selectKeeper(List.of(old, outside)));
        }

        @Test
        @DisplayName("Ties go to the first candidate")
        void testTies() {
            FileRecord a = file("/a.txt", 100, 10);
            FileRecord b = file("/b.txt", 100, 10);

            for (RetentionStrategy strategy : RetentionStrategy.values()) {
                assertEquals(a, policy(strategy).selectKeeper(List.of(a, b)), strategy.name());
                assertEquals(b, policy(strategy).selectKeeper(List.of(b, a)), strategy.name());
            }
        }

        @Test
        @DisplayName("Partition returns the other files in input order")
        void testPartition() {
            RetentionDecision decision = policy(RetentionStrategy.NEWEST).partition(group);

            assertEquals(recent, decision.keeper());
            assertEquals(List.of(old, mid), decision.removals());
            assertEquals(List.of(old.path(), mid.path()), decision.removalPaths());
            assertEquals("strategy:newest", decision.reason());
        }

        @Test
        @DisplayName("An empty candidate list is rejected")
        void testEmpty() {
            RetentionPolicy policy = new RetentionPolicy();
            assertThrows(IllegalArgumentException.class, () -> policy.selectKeeper(List.of()));
        }
    }

    @Nested
    @DisplayName("Priority patterns")
    class PriorityTests {

        private final FileRecord keepMe = file("/data/important/report.txt", 10, 0);
        private final FileRecord newer = file("/data/scratch/report.txt", 10, 100);

        @Test
        @DisplayName("A matching pattern wins over the strategy")
        void testPriorityWins() {
            RetentionPolicy policy = new RetentionPolicy(RetentionConfig.builder()
                    .strategy(RetentionStrategy.NEWEST)
                    .priorityPattern("important/*")
                    .build());

            RetentionDecision decision = policy.partition(List.of(newer, keepMe));

            assertEquals(keepMe, decision.keeper());
            assertEquals("priority:important/*", decision.reason());
        }

        @Test
        @DisplayName("Patterns are tried in declared order")
        void testPatternOrder() {
            RetentionPolicy policy = new RetentionPolicy(RetentionConfig.builder()
                    .priorityPattern("scratch/*")
                    .priorityPattern("important/*")
                    .build());

            assertEquals(newer, policy.selectKeeper(List.of(keepMe, newer)));
        }

        @Test
        @DisplayName("Absolute patterns must match the whole path")
        void testAbsolutePattern() {
            RetentionPolicy policy = new RetentionPolicy(RetentionConfig.builder()
                    .strategy(RetentionStrategy.NEWEST)
                    .priorityPattern("/data/important/*.txt")
                    .build());
            assertEquals(keepMe, policy.selectKeeper(List.of(newer, keepMe)));

            RetentionPolicy partial = new RetentionPolicy(RetentionConfig.builder()
                    .strategy(RetentionStrategy.NEWEST)
                    .priorityPattern("/important/*.txt")
                    .build());
            assertEquals(newer, partial.selectKeeper(List.of(newer, keepMe)));
        }

        @Test
        @DisplayName("Patterns are ignored unless consulted first")
        void testPriorityNotFirst() {
            RetentionPolicy policy = new RetentionPolicy(RetentionConfig.builder()
                    .strategy(RetentionStrategy.NEWEST)
                    .priorityPattern("important/*")
                    .priorityFirst(false)
                    .build());

            assertEquals(newer, policy.selectKeeper(List.of(keepMe, newer)));
        }

        @Test
        @DisplayName("No matching pattern falls back to the strategy")
        void testNoMatch() {
            RetentionPolicy policy = new RetentionPolicy(RetentionConfig.builder()
                    .priorityPattern("archive/**")
                    .build());

            assertEquals(newer, policy.selectKeeper(List.of(keepMe, newer)));
        }
    }

    @Nested
    @DisplayName("Keeper override")
    class OverrideTests {

        private final FileRecord a = file("/a.txt", 1, 0);
        private final FileRecord b = file("/b.txt", 1, 10);

        @Test
        @DisplayName("An override replaces the automatic choice")
        void testOverride() {
            RetentionDecision decision = new RetentionPolicy().partition(List.of(a, b), Path.of("/a.txt"));

            assertEquals(a, decision.keeper());
            assertEquals(List.of(b), decision.removals());
            assertEquals("override", decision.reason());
        }

        @Test
        @DisplayName("A null override means automatic selection")
        void testNullOverride() {
            assertEquals(b, new RetentionPolicy().partition(List.of(a, b), null).keeper());
        }

        @Test
        @DisplayName("An override outside the group is rejected")
        void testNonMember() {
            RetentionPolicy policy = new RetentionPolicy();
            assertThrows(IllegalArgumentException.class,
                    () -> policy.partition(List.of(a, b), Path.of("/c.txt")));
        }
    }

    @Nested
    @DisplayName("Strategy names")
    class NameTests {

        @ParameterizedTest
        @CsvSource({
                "newest, NEWEST",
                "OLDEST, OLDEST",
                "Largest, LARGEST",
                "smallest, SMALLEST",
                "shortest-relative-path, SHORTEST_RELATIVE_PATH",
                "shortest_path, SHORTEST_RELATIVE_PATH",
                "shortest-path, SHORTEST_RELATIVE_PATH"
        })
        @DisplayName("Should resolve names and aliases")
        void testFromName(String name, RetentionStrategy expected) {
            assertEquals(expected, RetentionStrategy.fromName(name));
        }

        @Test
        @DisplayName("Unknown names raise InvalidStrategyException")
        void testInvalid() {
            InvalidStrategyException ex = assertThrows(InvalidStrategyException.class,
                    () -> RetentionConfig.builder().strategy("biggest"));
            assertEquals("biggest", ex.getStrategy());
            assertTrue(ex.getMessage().contains("shortest-relative-path"));
            assertThrows(InvalidStrategyException.class, () -> RetentionStrategy.fromName(null));
        }

        @Test
        @DisplayName("Blank priority patterns are rejected")
        void testBlankPattern() {
            RetentionConfig.Builder builder = RetentionConfig.builder().priorityPattern(" ");
            assertThrows(IllegalArgumentException.class, builder::build);
        }
    }
}

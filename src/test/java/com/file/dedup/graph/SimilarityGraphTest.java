package com.file.dedup.graph;

import com.file.dedup.cache.SignatureCache;
import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.core.model.Signature;
import com.file.dedup.core.model.SimilarityEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SimilarityGraphTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    /**
     * Ten-position signature equal to the base pattern {@code seed*100 + i} except for
     * the first {@code differing} positions.
     */
    private static Signature signature(int seed, int differing) {
        long[] values = new long[10];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < differing ? 9_000 + seed * 100L + i : seed * 100L + i;
        }
        return Signature.of(values);
    }

    /**
     * Base pattern of {@code seed} with only the last position changed.
     */
    private static Signature lastDiffers(int seed) {
        long[] values = signature(seed, 0).toArray();
        values[values.length - 1] = 5_555;
        return Signature.of(values);
    }

    private static FileRecord file(String path, Signature signature) {
        return new FileRecord(Path.of(path), 100, T0, T0, signature);
    }

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("Files all similar to each other form exactly one group")
        void testAllSimilar() {
            SimilarityGraph graph = new SimilarityGraph(GraphConfig.withThreshold(0.8));
            List<FileRecord> files = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                files.add(file("/data/f" + i + ".txt", signature(1, 0)));
            }
            graph.add(files);

            List<DuplicateGroup> groups = graph.groups();
            assertEquals(1, groups.size());
            assertEquals(5, groups.get(0).size());
            assertEquals(1.0, groups.get(0).similarity(), 1e-9);
            assertEquals(10, groups.get(0).edgeCount());
        }

        @Test
        @DisplayName("Files with no similar pair form no group")
        void testNoneSimilar() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(
                    file("/a.txt", signature(1, 0)),
                    file("/b.txt", signature(2, 0)),
                    file("/c.txt", signature(3, 0))));

            assertTrue(graph.groups().isEmpty());
            assertEquals(3, graph.nodeCount());
            assertEquals(0, graph.edgeCount());
        }

        @Test
        @DisplayName("Zero or one file never produces a group")
        void testTrivialGraphs() {
            SimilarityGraph graph = new SimilarityGraph();
            assertTrue(graph.groups().isEmpty());
            graph.add(List.of(file("/a.txt", signature(1, 0))));
            assertTrue(graph.groups().isEmpty());
        }

        @Test
        @DisplayName("Threshold comparison is inclusive")
        void testInclusiveThreshold() {
            SimilarityGraph graph = new SimilarityGraph(GraphConfig.withThreshold(0.8));
            graph.add(List.of(file("/a.txt", signature(1, 0)), file("/b.txt", signature(1, 2))));

            assertEquals(1, graph.groups().size());
            assertEquals(0.8, graph.weight(Path.of("/a.txt"), Path.of("/b.txt")).orElseThrow(), 1e-9);
        }

        @Test
        @DisplayName("Groups sort by similarity descending, then by id")
        void testGroupOrder() {
            SimilarityGraph graph = new SimilarityGraph(GraphConfig.withThreshold(0.8));
            graph.add(List.of(
                    file("/g1/a.txt", signature(1, 0)),
                    file("/g1/b.txt", signature(1, 1)),
                    file("/g2/a.txt", signature(2, 0)),
                    file("/g2/b.txt", signature(2, 0)),
                    file("/g3/a.txt", signature(3, 0)),
                    file("/g3/b.txt", signature(3, 0))));

            List<DuplicateGroup> groups = graph.groups();
            assertEquals(3, groups.size());
            assertEquals(2, groups.get(0).id());
            assertEquals(4, groups.get(1).id());
            assertEquals(0, groups.get(2).id());
            assertEquals(0.9, groups.get(2).similarity(), 1e-9);
        }

        @Test
        @DisplayName("Group members are in lexical order")
        void testMemberOrder() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(
                    file("/z.txt", signature(1, 0)),
                    file("/a.txt", signature(1, 0)),
                    file("/m.txt", signature(1, 0))));

            assertEquals(List.of(Path.of("/a.txt"), Path.of("/m.txt"), Path.of("/z.txt")),
                    graph.groups().get(0).files());
        }

        @Test
        @DisplayName("Unsigned files stay isolated")
        void testUnsignedFiles() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(file("/a.txt", null), file("/b.txt", null)));

            assertEquals(2, graph.nodeCount());
            assertTrue(graph.groups().isEmpty());
            assertEquals(0, graph.comparisons());
        }
    }

    @Nested
    @DisplayName("Incremental add")
    class IncrementalTests {

        @Test
        @DisplayName("New files are compared once per existing component")
        void testComparisonsBoundedByComponents() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(
                    file("/a1.txt", signature(1, 0)),
                    file("/a2.txt", signature(1, 0)),
                    file("/a3.txt", signature(1, 0)),
                    file("/b1.txt", signature(2, 0)),
                    file("/b2.txt", signature(2, 0))));
            assertEquals(10, graph.comparisons());

            // two components exist; two new files compare with each other and with both representatives
            graph.add(List.of(file("/n1.txt", signature(1, 0)), file("/n2.txt", signature(3, 0))));

            assertEquals(10 + 1 + 2 * 2, graph.comparisons());
            assertEquals(2, graph.groups().size());
            assertTrue(graph.groups().stream().anyMatch(g -> g.contains(Path.of("/n1.txt")) && g.size() == 4));
        }

        @Test
        @DisplayName("Component inheritance connects new files to every member")
        void testComponentInheritance() {
            SimilarityGraph graph = new SimilarityGraph(GraphConfig.withThreshold(0.8));
            graph.add(List.of(file("/a.txt", signature(1, 0)), file("/b.txt", signature(1, 2))));
            // c matches the representative a at 0.9 but b only at 0.7
            graph.add(List.of(file("/c.txt", lastDiffers(1))));

            assertEquals(0.9, graph.weight(Path.of("/c.txt"), Path.of("/a.txt")).orElseThrow(), 1e-9);
            assertEquals(0.9, graph.weight(Path.of("/c.txt"), Path.of("/b.txt")).orElseThrow(), 1e-9);

            List<SimilarityEdge> edges = graph.pairwiseSimilarities(List.of(
                    Path.of("/a.txt"), Path.of("/b.txt"), Path.of("/c.txt")));
            assertEquals(3, edges.size());
            SimilarityEdge inherited = edges.stream()
                    .filter(e -> e.touches(Path.of("/b.txt")) && e.touches(Path.of("/c.txt")))
                    .findFirst().orElseThrow();
            assertTrue(inherited.inherited());
        }

        @Test
        @DisplayName("Representative-only inheritance links only to the representative")
        void testRepresentativeOnly() {
            SimilarityGraph graph = new SimilarityGraph(new GraphConfig(0.8, EdgeInheritance.REPRESENTATIVE_ONLY));
            graph.add(List.of(file("/a.txt", signature(1, 0)), file("/b.txt", signature(1, 2))));
            graph.add(List.of(file("/c.txt", lastDiffers(1))));

            assertTrue(graph.weight(Path.of("/c.txt"), Path.of("/b.txt")).isEmpty());
            assertEquals(1, graph.groups().size());
            assertEquals(3, graph.groups().get(0).size());
        }

        @Test
        @DisplayName("Adding a file already present is a no-op")
        void testReAdd() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(file("/a.txt", signature(1, 0)), file("/b.txt", signature(1, 0))));

            int added = graph.add(List.of(file("/a.txt", signature(2, 0))));

            assertEquals(0, added);
            assertEquals(2, graph.nodeCount());
            assertEquals(signature(1, 0), graph.findRecord(Path.of("/a.txt")).orElseThrow().signature());
        }

        @Test
        @DisplayName("Group ids stay stable as files are added")
        void testStableIds() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(file("/x.txt", signature(5, 0)), file("/y.txt", signature(5, 0))));
            int id = graph.groups().get(0).id();

            graph.add(List.of(file("/a.txt", signature(5, 0))));

            assertEquals(id, graph.groups().get(0).id());
            assertEquals(3, graph.groups().get(0).size());
        }

        @Test
        @DisplayName("Should reject signatures of different sizes")
        void testSizeMismatch() {
            SimilarityGraph graph = new SimilarityGraph();
            FileRecord small = file("/s.txt", Signature.of(new long[]{1, 2}));
            assertThrows(IllegalArgumentException.class,
                    () -> graph.add(List.of(file("/a.txt", signature(1, 0)), small)));
        }
    }

    @Nested
    @DisplayName("Removal")
    class RemovalTests {

        @Test
        @DisplayName("Remove drops nodes, incident edges and cached signatures")
        void testRemove() {
            SignatureCache cache = mock(SignatureCache.class);
            SimilarityGraph graph = new SimilarityGraph(GraphConfig.defaults(), cache);
            graph.add(List.of(
                    file("/a.txt", signature(1, 0)),
                    file("/b.txt", signature(1, 0)),
                    file("/c.txt", signature(1, 0))));

            int removed = graph.remove(List.of(Path.of("/a.txt"), Path.of("/missing.txt")));

            assertEquals(1, removed);
            assertFalse(graph.contains(Path.of("/a.txt")));
            assertEquals(1, graph.edgeCount());
            assertEquals(2, graph.groups().get(0).size());
            verify(cache).invalidate(Path.of("/a.txt"));
        }

        @Test
        @DisplayName("Dissolve removes edges but keeps nodes")
        void testDissolve() {
            SimilarityGraph graph = new SimilarityGraph();
            graph.add(List.of(
                    file("/a.txt", signature(1, 0)),
                    file("/b.txt", signature(1, 0)),
                    file("/c.txt", signature(1, 0))));

            int removed = graph.dissolve(List.of(Path.of("/a.txt"), Path.of("/b.txt")));

            assertEquals(1, removed);
            assertEquals(3, graph.nodeCount());
            assertEquals(2, graph.edgeCount());
            assertEquals(1, graph.groups().size());

            graph.dissolve(List.of(Path.of("/a.txt"), Path.of("/b.txt"), Path.of("/c.txt")));
            assertTrue(graph.groups().isEmpty());
            assertEquals(3, graph.nodeCount());
        }
    }

    @Test
    @DisplayName("Should reject a threshold outside (0, 1]")
    void testThresholdValidation() {
        assertThrows(IllegalArgumentException.class, () -> GraphConfig.withThreshold(0.0));
        assertThrows(IllegalArgumentException.class, () -> GraphConfig.withThreshold(1.1));
        assertDoesNotThrow(() -> GraphConfig.withThreshold(1.0));
    }
}

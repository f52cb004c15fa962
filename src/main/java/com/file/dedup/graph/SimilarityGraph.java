package com.file.dedup.graph;

import com.file.dedup.cache.NoOpSignatureCache;
import com.file.dedup.cache.SignatureCache;
import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.core.model.PathOrder;
import com.file.dedup.core.model.SimilarityEdge;
import com.file.dedup.core.model.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/**
 * Incremental weighted graph over files whose connected components are duplicate groups.
 *
 * <p>Files added in one batch are compared with each other directly. Against the graph as it
 * stood before the batch, each new file is compared only with the representative of every
 * existing component (its lexically smallest signed member), so the work per batch is
 * proportional to new files times components rather than new files times existing files.
 * A component member that differs noticeably from its representative can therefore be joined
 * to a new file it would not match directly; {@link EdgeInheritance} controls whether such
 * members receive inherited edges.</p>
 *
 * <p>Single writer: callers must not mutate the graph from several threads at once.</p>
 */
public class SimilarityGraph {
    private static final Logger log = LoggerFactory.getLogger(SimilarityGraph.class);

    private final GraphConfig config;
    private final SignatureCache signatureCache;
    private final Map<Path, Node> nodes = new LinkedHashMap<>();
    private final Map<Path, Map<Path, SimilarityEdge>> adjacency = new HashMap<>();
    private int nextSequence;
    private int edgeCount;
    private long comparisons;

    public SimilarityGraph() {
        this(GraphConfig.defaults(), new NoOpSignatureCache());
    }

    public SimilarityGraph(GraphConfig config) {
        this(config, new NoOpSignatureCache());
    }

    /**
     * @param config         threshold and inheritance policy
     * @param signatureCache caller-owned cache purged when files are removed
     */
    public SimilarityGraph(GraphConfig config, SignatureCache signatureCache) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.signatureCache = Objects.requireNonNull(signatureCache, "signatureCache is required");
    }

    public GraphConfig getConfig() {
        return config;
    }

    /**
     * Adds files as nodes and connects them to similar files.
     * Files already present are ignored; unsigned files become isolated nodes.
     *
     * @param files the files to add
     * @return the number of edges added
     * @throws IllegalArgumentException if signatures of different sizes are compared
     */
    public int add(Collection<FileRecord> files) {
        List<Component> existing = signedComponents();

        List<FileRecord> added = new ArrayList<>();
        for (FileRecord file : files) {
            if (nodes.containsKey(file.path())) {
                continue;
            }
            nodes.put(file.path(), new Node(file, nextSequence++));
            adjacency.put(file.path(), new HashMap<>());
            added.add(file);
        }
        List<FileRecord> signed = added.stream().filter(FileRecord::hasSignature).toList();

        int before = edgeCount;
        for (int i = 0; i < signed.size(); i++) {
            FileRecord a = signed.get(i);
            for (int j = i + 1; j < signed.size(); j++) {
                FileRecord b = signed.get(j);
                double weight = compare(a.signature(), b.signature());
                if (weight >= config.threshold()) {
                    putEdge(SimilarityEdge.measured(a.path(), b.path(), weight));
                }
            }
        }

        for (FileRecord file : signed) {
            for (Component component : existing) {
                double weight = compare(file.signature(), component.representative().signature());
                if (weight < config.threshold()) {
                    continue;
                }
                Path representative = component.representative().path();
                putEdge(SimilarityEdge.measured(file.path(), representative, weight));
                if (config.edgeInheritance() == EdgeInheritance.COMPONENT) {
                    for (Path member : component.members()) {
                        if (!member.equals(representative) && !hasEdge(file.path(), member)) {
                            putEdge(SimilarityEdge.inherited(file.path(), member, weight));
                        }
                    }
                }
            }
        }

        int created = edgeCount - before;
        log.debug("graph.add files={} new={} signed={} components={} edges={}",
                files.size(), added.size(), signed.size(), existing.size(), created);
        return created;
    }

    /**
     * Returns the connected components with at least two members, highest mean similarity first.
     */
    public List<DuplicateGroup> groups() {
        List<DuplicateGroup> groups = new ArrayList<>();
        for (List<Path> component : components()) {
            if (component.size() < 2) {
                continue;
            }
            int id = Integer.MAX_VALUE;
            double total = 0.0;
            int internal = 0;
            for (Path member : component) {
                id = Math.min(id, nodes.get(member).sequence());
                for (SimilarityEdge edge : adjacency.get(member).values()) {
                    // each undirected edge is seen from both ends; count it from the first
                    if (edge.first().equals(member)) {
                        total += edge.weight();
                        internal++;
                    }
                }
            }
            groups.add(new DuplicateGroup(id, component, total / internal, internal));
        }
        groups.sort(Comparator.comparingDouble(DuplicateGroup::similarity).reversed()
                .thenComparingInt(DuplicateGroup::id));
        return groups;
    }

    /**
     * Removes nodes and their edges, and purges the signature cache for those paths.
     *
     * @return the number of nodes removed
     */
    public int remove(Collection<Path> paths) {
        int removed = 0;
        for (Path raw : paths) {
            Path path = normalize(raw);
            signatureCache.invalidate(path);
            if (nodes.remove(path) == null) {
                continue;
            }
            Map<Path, SimilarityEdge> incident = adjacency.remove(path);
            for (Path neighbour : incident.keySet()) {
                adjacency.get(neighbour).remove(path);
            }
            edgeCount -= incident.size();
            removed++;
        }
        log.debug("graph.remove requested={} removed={}", paths.size(), removed);
        return removed;
    }

    /**
     * Removes every edge between two of the given paths. Nodes stay in the graph.
     *
     * @return the number of edges removed
     */
    public int dissolve(Collection<Path> paths) {
        Set<Path> members = normalizeAll(paths);
        int removed = 0;
        for (Path path : members) {
            Map<Path, SimilarityEdge> incident = adjacency.get(path);
            if (incident == null) {
                continue;
            }
            for (Path neighbour : new ArrayList<>(incident.keySet())) {
                if (members.contains(neighbour)) {
                    incident.remove(neighbour);
                    adjacency.get(neighbour).remove(path);
                    removed++;
                }
            }
        }
        edgeCount -= removed;
        log.debug("graph.dissolve members={} edgesRemoved={}", members.size(), removed);
        return removed;
    }

    /**
     * Returns the edges among the given paths, ordered by their endpoints.
     */
    public List<SimilarityEdge> pairwiseSimilarities(Collection<Path> paths) {
        Set<Path> members = normalizeAll(paths);
        Map<String, SimilarityEdge> ordered = new TreeMap<>();
        for (Path path : members) {
            Map<Path, SimilarityEdge> incident = adjacency.get(path);
            if (incident == null) {
                continue;
            }
            for (SimilarityEdge edge : incident.values()) {
                if (members.contains(edge.other(path))) {
                    ordered.putIfAbsent(edge.first() + "\u0000" + edge.second(), edge);
                }
            }
        }
        return List.copyOf(ordered.values());
    }

    public boolean contains(Path path) {
        return nodes.containsKey(normalize(path));
    }

    public Optional<FileRecord> findRecord(Path path) {
        Node node = nodes.get(normalize(path));
        return node == null ? Optional.empty() : Optional.of(node.record());
    }

    /**
     * Returns the weight of the edge between two files, if they are connected directly.
     */
    public OptionalDouble weight(Path a, Path b) {
        Map<Path, SimilarityEdge> incident = adjacency.get(normalize(a));
        if (incident == null) {
            return OptionalDouble.empty();
        }
        SimilarityEdge edge = incident.get(normalize(b));
        return edge == null ? OptionalDouble.empty() : OptionalDouble.of(edge.weight());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Total number of signature comparisons performed since the graph was created.
     */
    public long comparisons() {
        return comparisons;
    }

    private double compare(Signature a, Signature b) {
        comparisons++;
        return a.similarity(b);
    }

    private boolean hasEdge(Path a, Path b) {
        return adjacency.get(a).containsKey(b);
    }

    private void putEdge(SimilarityEdge edge) {
        Map<Path, SimilarityEdge> firstEdges = adjacency.get(edge.first());
        if (firstEdges.put(edge.second(), edge) == null) {
            edgeCount++;
        }
        adjacency.get(edge.second()).put(edge.first(), edge);
    }

    /**
     * Connected components in insertion order of their first node, members in lexical order.
     */
    private List<List<Path>> components() {
        List<List<Path>> result = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        for (Path start : nodes.keySet()) {
            if (!seen.add(start)) {
                continue;
            }
            List<Path> component = new ArrayList<>();
            Deque<Path> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                Path current = queue.poll();
                component.add(current);
                for (Path neighbour : adjacency.get(current).keySet()) {
                    if (seen.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            component.sort(PathOrder.LEXICAL);
            result.add(component);
        }
        return result;
    }

    private List<Component> signedComponents() {
        List<Component> result = new ArrayList<>();
        for (List<Path> members : components()) {
            // members are sorted, so the first signed one is the representative
            members.stream()
                    .map(p -> nodes.get(p).record())
                    .filter(FileRecord::hasSignature)
                    .findFirst()
                    .ifPresent(rep -> result.add(new Component(rep, members)));
        }
        return result;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static Set<Path> normalizeAll(Collection<Path> paths) {
        Set<Path> result = new LinkedHashSet<>();
        for (Path p : paths) {
            result.add(normalize(p));
        }
        return result;
    }

    private record Node(FileRecord record, int sequence) {
    }

    private record Component(FileRecord representative, List<Path> members) {
    }
}

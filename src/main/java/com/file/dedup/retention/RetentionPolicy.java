package com.file.dedup.retention;

import com.file.dedup.core.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic keeper selection for a duplicate group.
 *
 * <p>When priority patterns are configured and consulted first, each pattern is tried in
 * declared order against every candidate in input order, and the first match keeps its file.
 * A relative pattern matches any trailing portion of a path ({@code important/*} matches
 * {@code /data/important/a.txt}); an absolute pattern must match the whole path.
 * Otherwise the configured strategy decides, ties going to the earliest candidate.</p>
 */
public class RetentionPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetentionPolicy.class);

    private final RetentionConfig config;
    private final List<PriorityPattern> patterns;

    public RetentionPolicy() {
        this(RetentionConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException if a priority pattern is not a valid glob
     */
    public RetentionPolicy(RetentionConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
        List<PriorityPattern> compiled = new ArrayList<>();
        for (String pattern : config.priorityPatterns()) {
            compiled.add(new PriorityPattern(pattern,
                    FileSystems.getDefault().getPathMatcher("glob:" + pattern),
                    pattern.startsWith("/")));
        }
        this.patterns = List.copyOf(compiled);
    }

    public RetentionConfig getConfig() {
        return config;
    }

    /**
     * Chooses the file to keep.
     *
     * @param candidates the members of one group
     * @return the keeper
     * @throws IllegalArgumentException if there are no candidates
     */
    public FileRecord selectKeeper(List<FileRecord> candidates) {
        return decide(candidates).keeper();
    }

    /**
     * Splits a group into the keeper and the files selected for removal.
     *
     * @throws IllegalArgumentException if there are no candidates
     */
    public RetentionDecision partition(List<FileRecord> candidates) {
        return decide(candidates);
    }

    /**
     * Splits a group using an operator-chosen keeper instead of the automatic choice.
     *
     * @param keeperOverride the path to keep, or null for automatic selection
     * @throws IllegalArgumentException if there are no candidates or the override is not among them
     */
    public RetentionDecision partition(List<FileRecord> candidates, Path keeperOverride) {
        if (keeperOverride == null) {
            return decide(candidates);
        }
        requireCandidates(candidates);
        Path wanted = keeperOverride.toAbsolutePath().normalize();
        FileRecord keeper = candidates.stream()
                .filter(c -> c.path().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Keeper override is not a member of the group: " + keeperOverride));
        return split(candidates, keeper, "override");
    }

    private RetentionDecision decide(List<FileRecord> candidates) {
        requireCandidates(candidates);
        if (config.priorityFirst()) {
            for (PriorityPattern pattern : patterns) {
                for (FileRecord candidate : candidates) {
                    if (pattern.matches(candidate.path())) {
                        log.debug("retention.priorityMatch pattern={} keeper={}", pattern.glob(), candidate.path());
                        return split(candidates, candidate, "priority:" + pattern.glob());
                    }
                }
            }
        }
        FileRecord keeper = byStrategy(candidates);
        return split(candidates, keeper, "strategy:" + config.strategy().canonicalName());
    }

    private FileRecord byStrategy(List<FileRecord> candidates) {
        FileRecord best = candidates.get(0);
        for (FileRecord candidate : candidates.subList(1, candidates.size())) {
            if (isBetter(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    // strictly better only, so ties keep the earlier candidate
    private boolean isBetter(FileRecord candidate, FileRecord best) {
        return switch (config.strategy()) {
            case NEWEST -> candidate.modifiedTime().isAfter(best.modifiedTime());
            case OLDEST -> candidate.modifiedTime().isBefore(best.modifiedTime());
            case LARGEST -> candidate.size() > best.size();
            case SMALLEST -> candidate.size() < best.size();
            case SHORTEST_RELATIVE_PATH -> pathLength(candidate.path()) < pathLength(best.path());
        };
    }

    private int pathLength(Path path) {
        Path base = config.baseDir();
        if (base != null && path.startsWith(base)) {
            return base.relativize(path).toString().length();
        }
        return path.toString().length();
    }

    private static RetentionDecision split(List<FileRecord> candidates, FileRecord keeper, String reason) {
        List<FileRecord> removals = candidates.stream()
                .filter(c -> !c.path().equals(keeper.path()))
                .toList();
        return new RetentionDecision(keeper, removals, reason);
    }

    private static void requireCandidates(List<FileRecord> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot select a keeper from an empty candidate list");
        }
    }

    private record PriorityPattern(String glob, PathMatcher matcher, boolean absolute) {

        boolean matches(Path path) {
            if (absolute) {
                return matcher.matches(path);
            }
            int names = path.getNameCount();
            for (int i = names - 1; i >= 0; i--) {
                if (matcher.matches(path.subpath(i, names))) {
                    return true;
                }
            }
            return false;
        }
    }
}

package com.file.dedup.move;

import com.file.dedup.core.model.MoveOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Plans where the non-keeper members of each group go inside the holding area.
 *
 * <p>With structure preservation, a file under the base directory keeps its relative path;
 * any other file lands under its bare name. A destination already planned by this planner,
 * or already present on disk, gets a {@code _1}, {@code _2}, ... suffix before its extension.
 * Use one planner per consolidation run so that plans of different groups cannot collide.</p>
 */
public class MovePlanner {
    private static final Logger log = LoggerFactory.getLogger(MovePlanner.class);

    private final MoveConfig config;
    private final Set<Path> reserved = new HashSet<>();

    public MovePlanner(MoveConfig config) {
        this.config = config;
    }

    /**
     * Plans moves for every member except the keeper.
     *
     * @param groupId the group being consolidated
     * @param members all members of the group
     * @param keeper  the member that stays in place
     * @return one operation per non-keeper member, in member order
     * @throws IllegalArgumentException if the keeper is not a member
     */
    public List<MoveOperation> plan(int groupId, List<Path> members, Path keeper) {
        List<Path> normalized = members.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        Path keep = keeper.toAbsolutePath().normalize();
        if (!normalized.contains(keep)) {
            throw new IllegalArgumentException("Keeper " + keeper + " is not a member of group " + groupId);
        }

        Path root = config.perGroupDirectories()
                ? config.holdingDir().resolve("group_" + groupId)
                : config.holdingDir();
        Path base = null;
        if (config.preserveStructure()) {
            base = config.baseDir() != null ? config.baseDir() : commonAncestor(normalized);
        }

        List<MoveOperation> moves = new ArrayList<>();
        for (Path source : normalized) {
            if (source.equals(keep)) {
                continue;
            }
            Path destination;
            if (base != null && source.startsWith(base) && !source.equals(base)) {
                destination = root.resolve(base.relativize(source));
            } else {
                destination = root.resolve(source.getFileName());
            }
            destination = reserve(destination);
            moves.add(new MoveOperation(source, destination, groupId));
        }
        log.debug("move.planned groupId={} moves={} root={}", groupId, moves.size(), root);
        return moves;
    }

    private Path reserve(Path destination) {
        Path candidate = destination;
        String name = destination.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        int counter = 1;
        while (reserved.contains(candidate) || Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
            candidate = destination.resolveSibling(stem + "_" + counter + extension);
            counter++;
        }
        reserved.add(candidate);
        return candidate;
    }

    /**
     * Deepest directory containing every path, or null if they share no root.
     */
    static Path commonAncestor(List<Path> paths) {
        if (paths.isEmpty()) {
            return null;
        }
        Path ancestor = paths.get(0).getParent();
        for (Path path : paths) {
            while (ancestor != null && !path.startsWith(ancestor)) {
                ancestor = ancestor.getParent();
            }
        }
        return ancestor;
    }
}

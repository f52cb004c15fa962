package com.file.dedup.api;

import com.file.dedup.audit.OperationLog;
import com.file.dedup.audit.OperationStatus;
import com.file.dedup.cache.RelocationListener;
import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.core.model.MoveOperation;
import com.file.dedup.graph.SimilarityGraph;
import com.file.dedup.logging.LogContext;
import com.file.dedup.metrics.MetricsService;
import com.file.dedup.metrics.NoOpMetricsService;
import com.file.dedup.move.FileMover;
import com.file.dedup.move.FileOperationException;
import com.file.dedup.move.FileStoreFreeSpaceProbe;
import com.file.dedup.move.FreeSpaceProbe;
import com.file.dedup.move.MoveConfig;
import com.file.dedup.move.MovePlanner;
import com.file.dedup.move.MoveResult;
import com.file.dedup.move.MoveTransaction;
import com.file.dedup.move.NioFileMover;
import com.file.dedup.retention.RetentionConfig;
import com.file.dedup.retention.RetentionDecision;
import com.file.dedup.retention.RetentionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies keeper selection to every duplicate group and disposes of the other members.
 *
 * <p>All groups are planned before anything is touched, so an invalid keeper override fails
 * the run without side effects. In move mode each group's moves form one transaction: a
 * failure rolls that group back and aborts the run, while groups already consolidated stay
 * consolidated. In delete mode every deletion is attempted and failures are collected.
 * Files that leave their place are removed from the graph and reported to the registered
 * {@link RelocationListener}s.</p>
 */
public class ConsolidationService {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationService.class);

    private final RetentionPolicy retentionPolicy;
    private final MoveConfig moveConfig;
    private final MoveTransaction moveTransaction;
    private final FileMover fileMover;
    private final OperationLog operationLog;
    private final MetricsService metrics;
    private final List<RelocationListener> listeners;

    private ConsolidationService(Builder builder) {
        this.retentionPolicy = new RetentionPolicy(builder.retentionConfig);
        this.moveConfig = builder.moveConfig;
        this.fileMover = builder.fileMover;
        this.operationLog = builder.operationLog;
        this.metrics = builder.metricsService;
        this.listeners = List.copyOf(builder.listeners);
        this.moveTransaction = new MoveTransaction(fileMover, builder.freeSpaceProbe, operationLog, metrics);
    }

    public OperationLog getOperationLog() {
        return operationLog;
    }

    public RetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    /**
     * Decides keepers and plans moves without touching the filesystem.
     *
     * @param keeperOverrides operator-chosen keepers by group id; may be empty
     * @throws IllegalArgumentException if an override names an unknown group or a non-member
     */
    public List<GroupPlan> plan(DetectionResult result, ConsolidationMode mode, Map<Integer, Path> keeperOverrides) {
        Set<Integer> groupIds = new HashSet<>();
        result.groups().forEach(g -> groupIds.add(g.id()));
        for (Integer id : keeperOverrides.keySet()) {
            if (!groupIds.contains(id)) {
                throw new IllegalArgumentException("Keeper override for unknown group " + id);
            }
        }

        MovePlanner planner = new MovePlanner(moveConfig);
        List<GroupPlan> plans = new ArrayList<>();
        for (DuplicateGroup group : result.groups()) {
            List<FileRecord> members = records(result.graph(), group);
            RetentionDecision decision = retentionPolicy.partition(members, keeperOverrides.get(group.id()));
            List<MoveOperation> moves = mode == ConsolidationMode.MOVE
                    ? planner.plan(group.id(), group.files(), decision.keeper().path())
                    : List.of();
            plans.add(new GroupPlan(group, decision, moves));
        }
        return plans;
    }

    public ConsolidationReport consolidate(DetectionResult result, ConsolidationMode mode) {
        return consolidate(result, mode, Map.of());
    }

    /**
     * Consolidates every group of the detection result.
     *
     * @param keeperOverrides operator-chosen keepers by group id; may be empty
     * @throws IllegalArgumentException if an override names an unknown group or a non-member
     */
    public ConsolidationReport consolidate(DetectionResult result, ConsolidationMode mode,
                                           Map<Integer, Path> keeperOverrides) {
        if (result.groups().isEmpty()) {
            log.info("consolidation.noDuplicates");
            return ConsolidationReport.noDuplicates(mode);
        }

        List<GroupPlan> plans = plan(result, mode, keeperOverrides);
        if (mode == ConsolidationMode.REPORT || moveConfig.dryRun()) {
            return dryRun(mode, plans);
        }

        int processed = 0;
        int files = 0;
        long bytes = 0;
        List<String> failures = new ArrayList<>();
        for (GroupPlan plan : plans) {
            int groupId = plan.group().id();
            try (LogContext ctx = LogContext.forGroup(groupId)) {
                log.info("consolidation.group keeper={} reason={} removals={}",
                        plan.decision().keeper().path(), plan.decision().reason(), plan.decision().removals().size());
                if (mode == ConsolidationMode.MOVE) {
                    MoveResult moved;
                    try {
                        moved = moveTransaction.execute(plan.moves());
                    } catch (FileOperationException e) {
                        failures.add("Group " + groupId + ": " + e.getMessage());
                        log.error("consolidation.aborted groupId={} error={}", groupId, e.getMessage());
                        return new ConsolidationReport(ConsolidationReport.Status.ABORTED, mode, plans.size(),
                                processed, files, bytes, plans, failures);
                    }
                    List<Path> sources = new ArrayList<>();
                    for (MoveOperation move : moved.moved()) {
                        sources.add(move.getSource());
                        notifyRelocated(move.getSource(), move.getDestination());
                    }
                    result.graph().remove(sources);
                    files += moved.movedCount();
                    bytes += moved.totalBytes();
                    processed++;
                } else {
                    int before = failures.size();
                    List<Path> deleted = new ArrayList<>();
                    for (FileRecord removal : plan.decision().removals()) {
                        if (delete(removal, groupId, failures)) {
                            deleted.add(removal.path());
                            files++;
                            bytes += removal.size();
                        }
                    }
                    result.graph().remove(deleted);
                    if (failures.size() == before) {
                        processed++;
                    }
                }
            }
        }

        log.info("consolidation.completed mode={} groups={} files={} bytes={} failures={}",
                mode, processed, files, bytes, failures.size());
        return new ConsolidationReport(ConsolidationReport.Status.COMPLETED, mode, plans.size(),
                processed, files, bytes, plans, failures);
    }

    private boolean delete(FileRecord removal, int groupId, List<String> failures) {
        try {
            fileMover.delete(removal.path());
        } catch (IOException e) {
            log.error("delete.failed path={} error={}", removal.path(), e.toString());
            operationLog.recordDelete(removal.path(), groupId, OperationStatus.FAILED, e.toString());
            failures.add("Failed to delete " + removal.path() + ": " + e.getMessage());
            return false;
        }
        metrics.incrementDeletes();
        operationLog.recordDelete(removal.path(), groupId, OperationStatus.SUCCESS, null);
        notifyRelocated(removal.path(), null);
        log.info("delete.completed path={}", removal.path());
        return true;
    }

    private ConsolidationReport dryRun(ConsolidationMode mode, List<GroupPlan> plans) {
        int files = 0;
        long bytes = 0;
        for (GroupPlan plan : plans) {
            int groupId = plan.group().id();
            if (mode == ConsolidationMode.MOVE) {
                for (MoveOperation move : plan.moves()) {
                    operationLog.recordMove(move, OperationStatus.DRY_RUN, null);
                    log.info("move.dryRun source={} destination={}", move.getSource(), move.getDestination());
                }
            } else if (mode == ConsolidationMode.DELETE) {
                for (FileRecord removal : plan.decision().removals()) {
                    operationLog.recordDelete(removal.path(), groupId, OperationStatus.DRY_RUN, null);
                    log.info("delete.dryRun path={}", removal.path());
                }
            }
            for (FileRecord removal : plan.decision().removals()) {
                files++;
                bytes += removal.size();
            }
        }
        log.info("consolidation.dryRun mode={} groups={} files={} bytes={}", mode, plans.size(), files, bytes);
        return new ConsolidationReport(ConsolidationReport.Status.DRY_RUN, mode, plans.size(),
                plans.size(), files, bytes, plans, List.of());
    }

    private void notifyRelocated(Path source, Path destination) {
        for (RelocationListener listener : listeners) {
            listener.onRelocated(source, destination);
        }
    }

    private static List<FileRecord> records(SimilarityGraph graph, DuplicateGroup group) {
        List<FileRecord> records = new ArrayList<>(group.size());
        for (Path path : group.files()) {
            records.add(graph.findRecord(path).orElseThrow(() ->
                    new IllegalStateException("Group " + group.id() + " member no longer in graph: " + path)));
        }
        return records;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetentionConfig retentionConfig = RetentionConfig.defaults();
        private MoveConfig moveConfig = MoveConfig.defaults();
        private FileMover fileMover = new NioFileMover();
        private FreeSpaceProbe freeSpaceProbe = new FileStoreFreeSpaceProbe();
        private OperationLog operationLog = new OperationLog();
        private MetricsService metricsService = new NoOpMetricsService();
        private final List<RelocationListener> listeners = new ArrayList<>();

        public Builder retentionConfig(RetentionConfig retentionConfig) {
            this.retentionConfig = retentionConfig;
            return this;
        }

        public Builder moveConfig(MoveConfig moveConfig) {
            this.moveConfig = moveConfig;
            return this;
        }

        /**
         * Takes retention and move configuration from detection options.
         */
        public Builder options(DetectionOptions options) {
            this.retentionConfig = options.getRetentionConfig();
            this.moveConfig = options.getMoveConfig();
            return this;
        }

        public Builder fileMover(FileMover fileMover) {
            this.fileMover = fileMover;
            return this;
        }

        public Builder freeSpaceProbe(FreeSpaceProbe freeSpaceProbe) {
            this.freeSpaceProbe = freeSpaceProbe;
            return this;
        }

        public Builder operationLog(OperationLog operationLog) {
            this.operationLog = operationLog;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder listener(RelocationListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public ConsolidationService build() {
            if (retentionConfig == null || moveConfig == null) {
                throw new IllegalStateException("retentionConfig and moveConfig are required");
            }
            return new ConsolidationService(this);
        }
    }
}

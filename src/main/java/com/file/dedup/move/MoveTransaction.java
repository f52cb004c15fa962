package com.file.dedup.move;

import com.file.dedup.audit.OperationLog;
import com.file.dedup.audit.OperationStatus;
import com.file.dedup.core.model.MoveOperation;
import com.file.dedup.logging.LogContext;
import com.file.dedup.metrics.MetricsService;
import com.file.dedup.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes a batch of moves as one unit: either every move happens or, after a failure,
 * the moves already performed are undone in reverse order.
 *
 * <p>Before touching anything the batch is checked: every source must be readable, and every
 * destination directory (probed at its nearest existing ancestor) must have room for the
 * files planned into it. A failed check moves nothing.</p>
 *
 * <p>If undoing a move fails, the failure is logged, recorded in the operation log and
 * attached as a suppressed exception; the caller always sees the failure that aborted
 * the batch.</p>
 *
 * <p>Single writer. There is no cancellation once a batch has started.</p>
 */
public class MoveTransaction {
    private static final Logger log = LoggerFactory.getLogger(MoveTransaction.class);

    private final FileMover mover;
    private final FreeSpaceProbe freeSpaceProbe;
    private final OperationLog operationLog;
    private final MetricsService metrics;

    public MoveTransaction() {
        this(new NioFileMover(), new FileStoreFreeSpaceProbe(), new OperationLog(), new NoOpMetricsService());
    }

    public MoveTransaction(FileMover mover, FreeSpaceProbe freeSpaceProbe,
                           OperationLog operationLog, MetricsService metrics) {
        this.mover = Objects.requireNonNull(mover, "mover is required");
        this.freeSpaceProbe = Objects.requireNonNull(freeSpaceProbe, "freeSpaceProbe is required");
        this.operationLog = Objects.requireNonNull(operationLog, "operationLog is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public OperationLog getOperationLog() {
        return operationLog;
    }

    /**
     * Performs the moves in order.
     *
     * @param moves the planned moves; an empty list succeeds without touching the filesystem
     * @return the moved operations and their combined size
     * @throws InsufficientSpaceException if a destination lacks room (nothing moved)
     * @throws PermissionDeniedException  if access was refused (completed moves rolled back)
     * @throws FileOperationException     if any other filesystem operation failed (completed moves rolled back)
     */
    public MoveResult execute(List<MoveOperation> moves) {
        if (moves.isEmpty()) {
            log.debug("move.emptyBatch");
            return MoveResult.empty();
        }

        String batchId = LogContext.generateId();
        try (LogContext ctx = LogContext.forMoveBatch(batchId, moves.get(0).getGroupId())) {
            List<Long> sizes = preflight(moves);
            log.info("move.batchStarted moves={} bytes={}", moves.size(), sum(sizes));

            List<MoveOperation> completed = new ArrayList<>();
            long totalBytes = 0;
            try (CompensatingTransaction tx = new CompensatingTransaction()) {
                for (int i = 0; i < moves.size(); i++) {
                    MoveOperation move = moves.get(i);
                    tx.execute("move " + move.getSource(), () -> perform(move), () -> undo(move));
                    completed.add(move);
                    totalBytes += sizes.get(i);
                }
                tx.markSuccess();
            } catch (IOException e) {
                // steps map their own I/O failures; anything reaching here escaped that mapping
                throw toFileOperationException(e, null, "move");
            } catch (FileOperationException e) {
                log.error("move.batchFailed completed={} rolledBack={} error={}",
                        completed.size(), completed.size() - e.getSuppressed().length, e.getMessage());
                throw e;
            }

            log.info("move.batchCompleted moves={} bytes={}", completed.size(), totalBytes);
            return new MoveResult(completed, totalBytes);
        }
    }

    /**
     * Stats every source and checks free space per destination directory.
     *
     * @return source sizes in move order
     */
    private List<Long> preflight(List<MoveOperation> moves) {
        List<Long> sizes = new ArrayList<>(moves.size());
        Map<Path, Long> required = new LinkedHashMap<>();
        for (MoveOperation move : moves) {
            long size;
            try {
                size = mover.size(move.getSource());
            } catch (IOException e) {
                throw skipAll(moves, toFileOperationException(e, move.getSource(), "stat"));
            }
            sizes.add(size);
            required.merge(move.getDestination().getParent(), size, Long::sum);
        }

        for (Map.Entry<Path, Long> entry : required.entrySet()) {
            Path probeDir = nearestExistingAncestor(entry.getKey());
            long available;
            try {
                available = freeSpaceProbe.usableSpace(probeDir);
            } catch (IOException e) {
                throw skipAll(moves, toFileOperationException(e, probeDir, "probe"));
            }
            if (available < entry.getValue()) {
                log.warn("move.insufficientSpace directory={} required={} available={}",
                        entry.getKey(), entry.getValue(), available);
                throw skipAll(moves, new InsufficientSpaceException(entry.getKey(), entry.getValue(), available));
            }
        }
        return sizes;
    }

    private void perform(MoveOperation move) {
        Path source = move.getSource();
        Path destination = move.getDestination();
        try {
            mover.createDirectories(destination.getParent());
        } catch (IOException e) {
            operationLog.recordMove(move, OperationStatus.FAILED, e.toString());
            throw toFileOperationException(e, destination.getParent(), "mkdir");
        }
        try {
            mover.move(source, destination);
        } catch (IOException e) {
            log.error("move.failed source={} destination={} error={}", source, destination, e.toString());
            operationLog.recordMove(move, OperationStatus.FAILED, e.toString());
            throw toFileOperationException(e, source, "move");
        }
        move.markExecuted();
        metrics.incrementMovesExecuted();
        operationLog.recordMove(move, OperationStatus.SUCCESS, null);
        log.info("move.completed source={} destination={}", source, destination);
    }

    private void undo(MoveOperation move) throws IOException {
        try {
            Path parent = move.getSource().getParent();
            if (parent != null) {
                mover.createDirectories(parent);
            }
            mover.move(move.getDestination(), move.getSource());
        } catch (IOException e) {
            operationLog.recordRollback(move, OperationStatus.FAILED, e.toString());
            throw e;
        }
        move.markRolledBack();
        metrics.incrementRollbacks();
        operationLog.recordRollback(move, OperationStatus.SUCCESS, null);
        log.info("move.rolledBack source={} destination={}", move.getDestination(), move.getSource());
    }

    private FileOperationException skipAll(List<MoveOperation> moves, FileOperationException failure) {
        for (MoveOperation move : moves) {
            operationLog.recordMove(move, OperationStatus.SKIPPED, failure.getMessage());
        }
        return failure;
    }

    private static Path nearestExistingAncestor(Path directory) {
        Path current = directory;
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current != null ? current : directory.getRoot();
    }

    static FileOperationException toFileOperationException(IOException e, Path path, String operation) {
        if (e instanceof AccessDeniedException) {
            return new PermissionDeniedException(path, operation, e);
        }
        return new FileOperationException(
                "Failed to " + operation + " " + path + ": " + e.getMessage(), path, operation, e);
    }

    private static long sum(List<Long> values) {
        long total = 0;
        for (long v : values) {
            total += v;
        }
        return total;
    }
}

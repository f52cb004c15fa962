package com.file.dedup.audit;

import com.file.dedup.core.model.MoveOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for recording and querying filesystem operations.
 *
 * <p>Recording is best-effort: a repository that fails to persist a record is logged at
 * error level and does not interrupt the operation being recorded.</p>
 */
public class OperationLog {
    private static final Logger log = LoggerFactory.getLogger(OperationLog.class);

    private final OperationRepository repository;

    public OperationLog() {
        this(new InMemoryOperationRepository());
    }

    public OperationLog(OperationRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an entry.
     */
    public OperationRecord record(OperationRecord entry) {
        try {
            repository.save(entry);
        } catch (UncheckedIOException e) {
            log.error("operationLog.writeFailed operation={} source={} error={}",
                    entry.operation(), entry.source(), e.getMessage());
        }
        log.debug("operationLog.recorded operation={} status={} source={} destination={}",
                entry.operation(), entry.status(), entry.source(), entry.destination());
        return entry;
    }

    public OperationRecord recordMove(MoveOperation move, OperationStatus status, String message) {
        return record(OperationRecord.builder()
                .operation(OperationType.MOVE)
                .source(move.getSource())
                .destination(move.getDestination())
                .groupId(move.getGroupId())
                .status(status)
                .message(message)
                .build());
    }

    /**
     * Records the undoing of a move: the file travelled from the move's destination back to its source.
     */
    public OperationRecord recordRollback(MoveOperation move, OperationStatus status, String message) {
        return record(OperationRecord.builder()
                .operation(OperationType.ROLLBACK)
                .source(move.getDestination())
                .destination(move.getSource())
                .groupId(move.getGroupId())
                .status(status)
                .message(message)
                .build());
    }

    public OperationRecord recordDelete(Path path, int groupId, OperationStatus status, String message) {
        return record(OperationRecord.builder()
                .operation(OperationType.DELETE)
                .source(path)
                .groupId(groupId)
                .status(status)
                .message(message)
                .build());
    }

    public List<OperationRecord> getAllEntries() {
        return repository.findAll();
    }

    public List<OperationRecord> getEntriesForGroup(int groupId) {
        return repository.findByGroupId(groupId);
    }

    public List<OperationRecord> getEntriesByOperation(OperationType operation) {
        return repository.findByOperation(operation);
    }

    public List<OperationRecord> getEntriesByStatus(OperationStatus status) {
        return repository.findByStatus(status);
    }

    public int size() {
        return repository.count();
    }
}

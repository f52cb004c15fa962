package com.file.dedup.audit;

import java.util.List;

/**
 * Storage for operation records. Append-only.
 */
public interface OperationRepository {

    OperationRecord save(OperationRecord record);

    /**
     * Gets all records in the order they were saved.
     */
    List<OperationRecord> findAll();

    List<OperationRecord> findByGroupId(int groupId);

    List<OperationRecord> findByOperation(OperationType operation);

    List<OperationRecord> findByStatus(OperationStatus status);

    int count();
}

package com.file.dedup.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory implementation of OperationRepository.
 * Thread-safe via CopyOnWriteArrayList. This is the default.
 */
public class InMemoryOperationRepository implements OperationRepository {

    private final List<OperationRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public OperationRecord save(OperationRecord record) {
        records.add(record);
        return record;
    }

    @Override
    public List<OperationRecord> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    @Override
    public List<OperationRecord> findByGroupId(int groupId) {
        return filter(r -> r.groupId() == groupId);
    }

    @Override
    public List<OperationRecord> findByOperation(OperationType operation) {
        return filter(r -> r.operation() == operation);
    }

    @Override
    public List<OperationRecord> findByStatus(OperationStatus status) {
        return filter(r -> r.status() == status);
    }

    @Override
    public int count() {
        return records.size();
    }

    private List<OperationRecord> filter(Predicate<OperationRecord> predicate) {
        return records.stream().filter(predicate).toList();
    }
}

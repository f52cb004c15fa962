package com.file.dedup.audit;

/**
 * Kinds of filesystem mutation recorded in the operation log.
 */
public enum OperationType {
    MOVE,
    ROLLBACK,
    DELETE
}

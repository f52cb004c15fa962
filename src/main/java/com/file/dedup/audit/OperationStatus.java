package com.file.dedup.audit;

/**
 * Outcome of a recorded operation.
 */
public enum OperationStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    DRY_RUN
}

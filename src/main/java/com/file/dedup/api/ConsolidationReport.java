package com.file.dedup.api;

import java.util.List;

/**
 * Outcome of a consolidation run.
 *
 * @param status          overall outcome
 * @param mode            the consolidation mode used
 * @param groupCount      number of groups considered
 * @param groupsProcessed groups whose non-keepers were fully handled
 * @param filesAffected   files moved or deleted, or that would be in a dry run
 * @param bytesAffected   combined size of those files
 * @param plans           per-group plans, in group order
 * @param failures        failure messages; a delete failure does not stop the run
 */
public record ConsolidationReport(
        Status status,
        ConsolidationMode mode,
        int groupCount,
        int groupsProcessed,
        int filesAffected,
        long bytesAffected,
        List<GroupPlan> plans,
        List<String> failures
) {
    public enum Status {
        COMPLETED,
        NO_DUPLICATES,
        ABORTED,
        DRY_RUN
    }

    public ConsolidationReport {
        plans = List.copyOf(plans);
        failures = List.copyOf(failures);
    }

    public static ConsolidationReport noDuplicates(ConsolidationMode mode) {
        return new ConsolidationReport(Status.NO_DUPLICATES, mode, 0, 0, 0, 0, List.of(), List.of());
    }

    public boolean isSuccessful() {
        return status != Status.ABORTED && failures.isEmpty();
    }

    /**
     * The first failure message, or null.
     */
    public String failureMessage() {
        return failures.isEmpty() ? null : failures.get(0);
    }
}

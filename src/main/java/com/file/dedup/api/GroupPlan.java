package com.file.dedup.api;

import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.MoveOperation;
import com.file.dedup.retention.RetentionDecision;

import java.util.List;

/**
 * What consolidation does, or would do, with one group.
 *
 * @param group    the duplicate group
 * @param decision keeper and files selected for removal
 * @param moves    planned relocations; empty outside move mode
 */
public record GroupPlan(DuplicateGroup group, RetentionDecision decision, List<MoveOperation> moves) {

    public GroupPlan {
        moves = List.copyOf(moves);
    }
}

package com.file.dedup.move;

import com.file.dedup.core.model.MoveOperation;

import java.util.List;

/**
 * Outcome of a successful move batch.
 *
 * @param moved      the operations performed, in execution order
 * @param totalBytes combined size of the moved files
 */
public record MoveResult(List<MoveOperation> moved, long totalBytes) {

    public MoveResult {
        moved = List.copyOf(moved);
    }

    public static MoveResult empty() {
        return new MoveResult(List.of(), 0);
    }

    public int movedCount() {
        return moved.size();
    }
}

package com.storyloop.core.model;

import java.io.Serializable;

/**
 * Final result of one task within a run.
 *
 * @param attempts number of worker attempts dispatched (0 when skipped)
 * @param detail   human-readable reason for non-merged outcomes, or the merge commit
 */
public record TaskOutcome(
    String taskId,
    Status status,
    int attempts,
    String detail
) implements Serializable {

    public enum Status {
        MERGED,
        FAILED,
        MERGE_CONFLICT,
        SKIPPED_DEPENDENCY_FAILED
    }

    public boolean merged() {
        return status == Status.MERGED;
    }
}

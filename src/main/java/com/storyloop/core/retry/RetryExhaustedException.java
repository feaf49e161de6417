package com.storyloop.core.retry;

import com.storyloop.core.model.FailureType;

/**
 * A task failed terminally: the retry ceiling was reached or its failure category is not
 * retried. Requires external review; sibling tasks continue.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String taskId;
    private final FailureType failureType;

    public RetryExhaustedException(String taskId, FailureType failureType, String reason) {
        super("Task " + taskId + " will not be retried (" + failureType.code() + "): " + reason);
        this.taskId = taskId;
        this.failureType = failureType;
    }

    public String getTaskId() {
        return taskId;
    }

    public FailureType getFailureType() {
        return failureType;
    }
}

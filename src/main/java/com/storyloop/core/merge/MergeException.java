package com.storyloop.core.merge;

import java.util.List;

/**
 * Merge-back of a single task failed. The task's branch is left in place for resolution;
 * sibling tasks are unaffected.
 */
public class MergeException extends RuntimeException {

    private final String taskId;
    private final List<String> conflictingFiles;

    public MergeException(String taskId, String message) {
        this(taskId, message, List.of(), null);
    }

    public MergeException(String taskId, String message, List<String> conflictingFiles, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.conflictingFiles = List.copyOf(conflictingFiles);
    }

    public String getTaskId() {
        return taskId;
    }

    public List<String> getConflictingFiles() {
        return conflictingFiles;
    }
}

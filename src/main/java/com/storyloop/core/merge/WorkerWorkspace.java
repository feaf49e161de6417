package com.storyloop.core.merge;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Isolated branch and worktree owned by one task attempt.
 *
 * <p>Closing releases the worktree and deletes the branch, whatever path the caller
 * exits by. Closing more than once is a no-op. After {@link #preserveBranch()} the branch
 * survives release so a conflicted merge can be resolved by hand.
 */
public final class WorkerWorkspace implements AutoCloseable {

    private final String taskId;
    private final String branch;
    private final Path path;
    private final MergeController owner;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean preserveBranch;

    WorkerWorkspace(String taskId, String branch, Path path, MergeController owner) {
        this.taskId = taskId;
        this.branch = branch;
        this.path = path;
        this.owner = owner;
    }

    public String taskId() {
        return taskId;
    }

    public String branch() {
        return branch;
    }

    public Path path() {
        return path;
    }

    public boolean isReleased() {
        return released.get();
    }

    public boolean isBranchPreserved() {
        return preserveBranch;
    }

    public void preserveBranch() {
        this.preserveBranch = true;
    }

    /** Marks this workspace released; returns false if it already was. */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "WorkerWorkspace[" + taskId + " @ " + branch + "]";
    }
}

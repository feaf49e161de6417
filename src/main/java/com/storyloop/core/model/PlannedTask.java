package com.storyloop.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Per-task entry of an {@link ExecutionPlan}.
 *
 * @param batch 1-based batch number
 */
public record PlannedTask(
    String id,
    String title,
    int batch,
    List<String> dependencies,
    Set<String> fileScope,
    int priority
) implements Serializable {

    public static PlannedTask of(Task task, int batch) {
        return new PlannedTask(task.id(), task.title(), batch,
                task.dependencies(), task.fileScope(), task.priority());
    }
}

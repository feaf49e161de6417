package com.storyloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregated view of a planning pass, consumed by the orchestrator and by
 * observers such as the CLI {@code plan} command.
 *
 * @param batches         parallel batches in execution order
 * @param totalTasks      number of tasks across all batches
 * @param sequentialSteps number of batches that must run one after another
 * @param maxParallelism  width of the widest batch
 * @param taskDetails     per-task metadata in execution order
 */
public record ExecutionPlan(
    List<List<String>> batches,
    int totalTasks,
    int sequentialSteps,
    int maxParallelism,
    List<PlannedTask> taskDetails
) implements Serializable {

    public ExecutionPlan {
        batches = batches.stream().map(List::copyOf).toList();
        taskDetails = List.copyOf(taskDetails);
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of(), 0, 0, 0, List.of());
    }

    public boolean isEmpty() {
        return totalTasks == 0;
    }

    /** Returns the 1-based batch number of the given task, or -1 if it is not planned. */
    public int batchOf(String taskId) {
        return taskDetails.stream()
                .filter(t -> t.id().equals(taskId))
                .mapToInt(PlannedTask::batch)
                .findFirst()
                .orElse(-1);
    }
}

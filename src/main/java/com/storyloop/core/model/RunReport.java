package com.storyloop.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a complete orchestrator run.
 *
 * @param outcomes per-task outcome in the order tasks were resolved
 */
public record RunReport(
    String runId,
    ExecutionPlan plan,
    List<Wave> waves,
    Map<String, TaskOutcome> outcomes,
    Duration elapsed
) implements Serializable {

    public RunReport {
        waves = List.copyOf(waves);
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public List<String> mergedIds() {
        return idsWith(TaskOutcome.Status.MERGED);
    }

    public List<String> idsWith(TaskOutcome.Status status) {
        return outcomes.values().stream()
                .filter(o -> o.status() == status)
                .map(TaskOutcome::taskId)
                .toList();
    }

    public boolean allMerged() {
        return outcomes.values().stream().allMatch(TaskOutcome::merged);
    }
}

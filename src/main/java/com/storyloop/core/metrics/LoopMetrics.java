package com.storyloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the orchestration engine.
 */
@Service
public class LoopMetrics {

    private final MeterRegistry registry;

    public LoopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("storyloop.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskExecution(String outcome, long ms) {
        Timer.builder("storyloop.task.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(boolean allMerged) {
        Counter.builder("storyloop.runs.total")
                .tag("status", allMerged ? "merged" : "partial")
                .register(registry)
                .increment();
    }

    /**
     * Records a task pulled out of its parallel wave because its file scope overlaps
     * a task already claimed for that wave.
     */
    public void recordFileScopeDeferral() {
        Counter.builder("storyloop.parallel.file_scope_deferrals")
                .description("Tasks serialized due to file-scope overlap")
                .register(registry)
                .increment();
    }

    /**
     * @param result "merged" or "conflicted"
     */
    public void recordMergeResult(String result) {
        Counter.builder("storyloop.merge.results")
                .description("Merge-back outcomes")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordLockWait(long ms) {
        Timer.builder("storyloop.merge.lock_wait")
                .description("Time spent waiting for the base reference lock")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records worktree operations for monitoring worker isolation.
     *
     * @param operation "create", "release" or "cleanup"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("storyloop.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordHealthClassification(String status) {
        Counter.builder("storyloop.health.classifications")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRetryDecision(String failureType, boolean granted) {
        Counter.builder("storyloop.retry.decisions")
                .tag("failure_type", failureType)
                .tag("result", granted ? "granted" : "denied")
                .register(registry)
                .increment();
    }

    /**
     * Records batch execution metrics.
     *
     * @param taskCount number of tasks dispatched together
     * @param mode      "parallel" or "sequential"
     */
    public void recordWaveExecution(int taskCount, String mode) {
        Counter.builder("storyloop.wave.executions")
                .description("Wave executions by mode")
                .tag("mode", mode)
                .register(registry)
                .increment();

        DistributionSummary.builder("storyloop.wave.task_count")
                .description("Number of tasks per wave")
                .tag("mode", mode)
                .register(registry)
                .record(taskCount);
    }
}

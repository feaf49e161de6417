package com.storyloop.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LoopMetricsTest {

    private SimpleMeterRegistry registry;
    private LoopMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LoopMetrics(registry);
    }

    @Test
    @DisplayName("recordPlanningDuration creates a timer")
    void recordPlanningDuration() {
        metrics.recordPlanningDuration(1500);
        var timer = registry.find("storyloop.planning.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    @DisplayName("recordTaskExecution tags by outcome")
    void recordTaskExecution() {
        metrics.recordTaskExecution("completed", 200);
        metrics.recordTaskExecution("completed", 300);
        metrics.recordTaskExecution("failed", 50);

        assertEquals(2, registry.find("storyloop.task.duration").tag("outcome", "completed").timer().count());
        assertEquals(1, registry.find("storyloop.task.duration").tag("outcome", "failed").timer().count());
    }

    @Test
    @DisplayName("recordRunResult splits merged and partial runs")
    void recordRunResult() {
        metrics.recordRunResult(true);
        metrics.recordRunResult(false);
        metrics.recordRunResult(false);

        assertEquals(1.0, registry.find("storyloop.runs.total").tag("status", "merged").counter().count());
        assertEquals(2.0, registry.find("storyloop.runs.total").tag("status", "partial").counter().count());
    }

    @Test
    @DisplayName("recordWorktreeOperation tags operation and success")
    void recordWorktreeOperation() {
        metrics.recordWorktreeOperation("create", true);
        metrics.recordWorktreeOperation("create", false);
        metrics.recordWorktreeOperation("release", true);

        var created = registry.find("storyloop.worktree.operations")
                .tag("operation", "create").tag("success", "true").counter();
        var failed = registry.find("storyloop.worktree.operations")
                .tag("operation", "create").tag("success", "false").counter();
        assertEquals(1.0, created.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordWaveExecution counts waves and their sizes")
    void recordWaveExecution() {
        metrics.recordWaveExecution(3, "parallel");
        metrics.recordWaveExecution(1, "sequential");

        assertEquals(1.0, registry.find("storyloop.wave.executions").tag("mode", "parallel").counter().count());
        var sizes = registry.find("storyloop.wave.task_count").tag("mode", "parallel").summary();
        assertNotNull(sizes);
        assertEquals(3.0, sizes.totalAmount());
    }

    @Test
    @DisplayName("recordFileScopeDeferral and recordLockWait register their meters")
    void mergeMeters() {
        metrics.recordFileScopeDeferral();
        metrics.recordMergeResult("conflicted");
        metrics.recordLockWait(40);

        assertEquals(1.0, registry.find("storyloop.parallel.file_scope_deferrals").counter().count());
        assertEquals(1.0, registry.find("storyloop.merge.results").tag("result", "conflicted").counter().count());
        assertEquals(1, registry.find("storyloop.merge.lock_wait").timer().count());
    }
}

package com.storyloop.core.health;

import java.util.Map;

/**
 * Resource figures a worker reports with each heartbeat.
 *
 * @param memoryMb      resident memory of the worker, in megabytes
 * @param externalCalls number of external (model/API) calls made so far
 * @param context       free-form details; a numeric {@code pid} entry enables process-liveness checks
 */
public record WorkerStats(double memoryMb, int externalCalls, Map<String, Object> context) {

    public WorkerStats {
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    public static WorkerStats empty() {
        return new WorkerStats(0, 0, Map.of());
    }

    public static WorkerStats withPid(long pid) {
        return new WorkerStats(0, 0, Map.of(Heartbeat.PID_KEY, pid));
    }
}

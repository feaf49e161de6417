package com.storyloop.core.health;

import java.time.Duration;

/**
 * Result of one health check.
 *
 * @param age       heartbeat age at check time; null when no readable record exists
 * @param heartbeat the record the classification was based on; null when UNKNOWN
 * @param reason    short explanation of the classification
 */
public record WorkerHealth(
    String workerId,
    WorkerStatus status,
    Duration age,
    Heartbeat heartbeat,
    String reason
) {

    static WorkerHealth unknown(String workerId, String reason) {
        return new WorkerHealth(workerId, WorkerStatus.UNKNOWN, null, null, reason);
    }

    public String taskId() {
        return heartbeat != null ? heartbeat.taskId() : null;
    }
}

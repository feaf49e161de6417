package com.storyloop.core.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of the append-only health log, written for every non-healthy classification.
 */
public record HealthEvent(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("worker_id") String workerId,
    @JsonProperty("status") WorkerStatus status,
    @JsonProperty("age_seconds") Long ageSeconds,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("iteration") Integer iteration,
    @JsonProperty("reason") String reason
) {

    static HealthEvent of(Instant timestamp, WorkerHealth health) {
        Heartbeat hb = health.heartbeat();
        return new HealthEvent(timestamp, health.workerId(), health.status(),
                health.age() != null ? health.age().toSeconds() : null,
                hb != null ? hb.taskId() : null,
                hb != null ? hb.iteration() : null,
                health.reason());
    }
}

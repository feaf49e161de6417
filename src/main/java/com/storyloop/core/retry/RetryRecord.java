package com.storyloop.core.retry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of the append-only retry log.
 */
public record RetryRecord(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("run_id") String runId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("attempt") int attempt,
    @JsonProperty("failure_type") String failureType,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("backoff_seconds") double backoffSeconds,
    @JsonProperty("will_retry") boolean willRetry,
    @JsonProperty("reason") String reason
) {
}

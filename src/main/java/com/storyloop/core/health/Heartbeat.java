package com.storyloop.core.health;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Latest liveness record of one worker, stored as {@code workers/<workerId>/heartbeat.json}.
 * Agents writing the older {@code story_id}/{@code api_calls_made} names are read as well.
 */
public record Heartbeat(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("worker_id") String workerId,
    @JsonProperty("task_id") @JsonAlias("story_id") String taskId,
    @JsonProperty("iteration") int iteration,
    @JsonProperty("memory_mb") double memoryMb,
    @JsonProperty("external_calls") @JsonAlias("api_calls_made") int externalCalls,
    @JsonProperty("context") Map<String, Object> context
) {

    static final String PID_KEY = "pid";

    public Heartbeat {
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    /** Process id recorded in the context, if any. */
    @JsonIgnore
    public Optional<Long> pid() {
        Object value = context.get(PID_KEY);
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}

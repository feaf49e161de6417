package com.storyloop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted during a run. Immutable once emitted.
 *
 * @param type      dotted event type (e.g. "story.started", "worker.dead")
 * @param data      arbitrary key-value payload
 * @param timestamp when the event was emitted
 * @param source    emitting component
 * @param runId     run this event belongs to (nullable)
 * @param taskId    task this event relates to (nullable for run-level events)
 */
public record LoopEvent(
    String type,
    Map<String, Object> data,
    Instant timestamp,
    String source,
    String runId,
    String taskId
) implements Serializable {

    public LoopEvent {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }
}

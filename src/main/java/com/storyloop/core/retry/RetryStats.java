package com.storyloop.core.retry;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates over the retry log. Counts include granted retries only.
 *
 * @param recent the most recent records, newest first
 */
public record RetryStats(
    int totalRetries,
    Map<String, Integer> byTask,
    Map<String, Integer> byFailureType,
    List<RetryRecord> recent
) {

    public RetryStats {
        byTask = Collections.unmodifiableMap(new TreeMap<>(byTask));
        byFailureType = Collections.unmodifiableMap(new TreeMap<>(byFailureType));
        recent = List.copyOf(recent);
    }
}

package com.storyloop.core.events;

import java.util.Map;

/**
 * Snapshot of bus counters.
 */
public record EventStats(long totalEvents, Map<String, Long> byType, int handlers, int historySize) {

    public EventStats {
        byType = Map.copyOf(byType);
    }
}

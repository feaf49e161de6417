package com.storyloop.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single story from the requirements document, the unit the engine schedules,
 * isolates and merges.
 *
 * @param id           unique identifier (e.g., "US-001")
 * @param title        short human-readable title
 * @param dependencies IDs of tasks that must be merged first, in declaration order
 * @param fileScope    path patterns this task expects to modify, used for conflict detection
 * @param priority     lower value = more urgent; ties are broken by declaration order
 * @param complete     true when the story already passes and is excluded in incomplete-only planning
 */
public record Task(
    String id,
    String title,
    List<String> dependencies,
    Set<String> fileScope,
    int priority,
    boolean complete
) implements Serializable {

    /** Priority used when the requirements document does not declare one. */
    public static final int DEFAULT_PRIORITY = 999;

    public Task {
        Objects.requireNonNull(id, "task id");
        title = title != null ? title : "";
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        fileScope = fileScope != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(fileScope))
                : Set.of();
    }

    public static Task of(String id, int priority, List<String> dependencies, Set<String> fileScope) {
        return new Task(id, id, dependencies, fileScope, priority, false);
    }
}

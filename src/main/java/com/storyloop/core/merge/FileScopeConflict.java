package com.storyloop.core.merge;

import java.util.List;

/**
 * A pair of tasks whose file scopes overlap.
 *
 * @param overlappingPaths sorted normalised patterns involved in the overlap
 */
public record FileScopeConflict(String first, String second, List<String> overlappingPaths) {

    public FileScopeConflict {
        overlappingPaths = List.copyOf(overlappingPaths);
    }

    public boolean involves(String taskId) {
        return first.equals(taskId) || second.equals(taskId);
    }
}

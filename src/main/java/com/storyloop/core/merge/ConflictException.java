package com.storyloop.core.merge;

import java.util.List;

/**
 * Tasks about to run concurrently have overlapping file scopes.
 */
public class ConflictException extends RuntimeException {

    private final List<FileScopeConflict> conflicts;

    public ConflictException(List<FileScopeConflict> conflicts) {
        super("File-scope conflicts in parallel wave: " + conflicts);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<FileScopeConflict> getConflicts() {
        return conflicts;
    }
}

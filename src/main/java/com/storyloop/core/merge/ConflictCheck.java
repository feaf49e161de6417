package com.storyloop.core.merge;

import com.storyloop.core.model.Wave;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of splitting one dependency batch by file scope.
 *
 * @param parallel  members that may run together, in priority order
 * @param deferred  members pulled out because they overlap an earlier member; each runs alone
 * @param conflicts every overlapping pair found in the batch
 */
public record ConflictCheck(List<String> parallel, List<String> deferred, List<FileScopeConflict> conflicts) {

    public ConflictCheck {
        parallel = List.copyOf(parallel);
        deferred = List.copyOf(deferred);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Expands into dispatch waves: the parallel wave first, then one single-task wave per
     * deferred member.
     */
    public List<Wave> waves(int batchNumber) {
        List<Wave> waves = new ArrayList<>();
        if (!parallel.isEmpty()) {
            waves.add(new Wave(batchNumber, 0, parallel));
        }
        for (int i = 0; i < deferred.size(); i++) {
            waves.add(new Wave(batchNumber, i + 1, List.of(deferred.get(i))));
        }
        return waves;
    }
}

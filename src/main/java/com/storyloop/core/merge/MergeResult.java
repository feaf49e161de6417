package com.storyloop.core.merge;

import java.util.List;

/**
 * Successful merge-back of one worker branch.
 *
 * @param commit      tip of the base reference after the fast-forward
 * @param filesMerged paths changed by the worker relative to the base
 */
public record MergeResult(String taskId, String branch, String commit, List<String> filesMerged) {

    public MergeResult {
        filesMerged = List.copyOf(filesMerged);
    }
}

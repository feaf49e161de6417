package com.storyloop.core.engine;

import com.storyloop.core.model.Task;

import java.nio.file.Path;

/**
 * Everything a launcher needs to start one worker attempt.
 *
 * @param workspace     isolated worktree the agent runs in
 * @param heartbeatFile where the agent should rewrite its heartbeat
 * @param workerDir     per-worker state directory (heartbeat, log, optional result file)
 */
public record WorkerRequest(
    String runId,
    Task task,
    String workerId,
    int attempt,
    Path workspace,
    Path heartbeatFile,
    Path workerDir
) {
}

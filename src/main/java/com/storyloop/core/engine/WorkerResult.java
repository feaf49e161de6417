package com.storyloop.core.engine;

import com.storyloop.core.model.FailureType;

import java.time.Duration;

/**
 * What the engine observed about a finished worker attempt.
 *
 * @param exitCode    process exit status, or -1 when the worker was reclaimed
 * @param failureType null on success
 */
public record WorkerResult(int exitCode, Duration elapsed, FailureType failureType, String message) {

    static final int EXIT_TIMEOUT = 124;
    static final int EXIT_KILLED = 137;

    public boolean succeeded() {
        return failureType == null;
    }

    public static WorkerResult success(Duration elapsed) {
        return new WorkerResult(0, elapsed, null, "completed");
    }

    public static WorkerResult failure(FailureType type, Duration elapsed, String message) {
        return new WorkerResult(-1, elapsed, type, message);
    }

    /**
     * Maps an exit status to a failure category: 0 succeeds, 124 (timeout(1) convention)
     * is TIMEOUT, 137 (SIGKILL, usually the OOM killer) is RESOURCE_EXHAUSTION, anything
     * else is UNKNOWN.
     */
    public static WorkerResult fromExitCode(int exitCode, Duration elapsed) {
        return switch (exitCode) {
            case 0 -> success(elapsed);
            case EXIT_TIMEOUT -> new WorkerResult(exitCode, elapsed, FailureType.TIMEOUT, "worker timed out");
            case EXIT_KILLED -> new WorkerResult(exitCode, elapsed, FailureType.RESOURCE_EXHAUSTION,
                    "worker was killed (exit 137)");
            default -> new WorkerResult(exitCode, elapsed, FailureType.UNKNOWN, "worker exited with " + exitCode);
        };
    }
}

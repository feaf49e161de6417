package com.storyloop.core.engine;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A running worker attempt.
 */
public interface WorkerHandle {

    /** OS process id, when the worker is a local process. */
    Optional<Long> pid();

    /** Completes when the worker exits. */
    CompletableFuture<WorkerResult> completion();

    /** Forcibly terminates the worker. No cooperative signal is sent first. */
    void destroy();
}

package com.storyloop.core.engine;

/**
 * Starts the external coding agent for one task attempt.
 */
public interface WorkerLauncher {

    /**
     * @throws IllegalStateException if the worker could not be started
     */
    WorkerHandle launch(WorkerRequest request);
}

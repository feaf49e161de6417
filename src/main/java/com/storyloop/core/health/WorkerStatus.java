package com.storyloop.core.health;

/**
 * Liveness classification of a worker, derived from heartbeat age at query time.
 */
public enum WorkerStatus {
    /** No heartbeat record, or the record could not be read. */
    UNKNOWN,
    HEALTHY,
    HUNG,
    DEAD;

    public boolean isUnhealthy() {
        return this == HUNG || this == DEAD;
    }
}

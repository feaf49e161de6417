package com.storyloop.core.health;

import java.util.Optional;

/**
 * Checks whether an OS process is alive.
 */
@FunctionalInterface
public interface ProcessProbe {

    /**
     * @return whether the process is running, or empty if liveness cannot be determined
     *         on this platform
     */
    Optional<Boolean> isRunning(long pid);

    /** Probe that never knows; classification then relies on heartbeat age alone. */
    static ProcessProbe unavailable() {
        return pid -> Optional.empty();
    }
}

package com.storyloop.core.engine;

import java.time.Duration;

/**
 * Blocks the calling thread for a retry backoff. Replaced in tests to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

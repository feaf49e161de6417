package com.storyloop.core.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link ProcessProbe} backed by {@link ProcessHandle}.
 */
public class ProcessHandleProbe implements ProcessProbe {

    private static final Logger log = LoggerFactory.getLogger(ProcessHandleProbe.class);

    @Override
    public Optional<Boolean> isRunning(long pid) {
        try {
            return Optional.of(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
        } catch (UnsupportedOperationException | SecurityException e) {
            log.debug("Process liveness unavailable for pid {}: {}", pid, e.getMessage());
            return Optional.empty();
        }
    }
}

package com.storyloop.core.health;

/**
 * A heartbeat record exists but cannot be read or parsed. Never escapes
 * {@link HealthMonitor}; the worker is classified UNKNOWN instead.
 */
class HeartbeatException extends RuntimeException {

    HeartbeatException(String message, Throwable cause) {
        super(message, cause);
    }
}

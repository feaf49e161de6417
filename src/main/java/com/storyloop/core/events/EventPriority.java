package com.storyloop.core.events;

/**
 * Standard handler priorities. Higher values are dispatched first.
 */
public enum EventPriority {
    CRITICAL(100),
    HIGH(75),
    NORMAL(50),
    LOW(25),
    BACKGROUND(0);

    private final int value;

    EventPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}

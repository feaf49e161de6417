package com.storyloop.core.health;

/**
 * Worker counts by status.
 */
public record HealthSummary(int total, int healthy, int hung, int dead, int unknown) {
}

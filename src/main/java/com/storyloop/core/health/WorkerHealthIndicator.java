package com.storyloop.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator summarising worker heartbeats.
 * <p>
 * Reports UP when every known worker is healthy (or none is running), DEGRADED when any
 * worker is HUNG and DOWN when any is DEAD. Reading heartbeats here never writes health events.
 */
@Component("workerHealthIndicator")
public class WorkerHealthIndicator implements HealthIndicator {

    private final HealthMonitor healthMonitor;

    public WorkerHealthIndicator(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Health health() {
        HealthSummary summary;
        try {
            summary = healthMonitor.summary();
        } catch (RuntimeException e) {
            return Health.unknown().withDetail("reason", String.valueOf(e.getMessage())).build();
        }

        var builder = summary.dead() > 0 ? Health.down()
                : summary.hung() > 0 ? Health.status("DEGRADED")
                : Health.up();
        return builder
                .withDetail("workers.total", summary.total())
                .withDetail("workers.healthy", summary.healthy())
                .withDetail("workers.hung", summary.hung())
                .withDetail("workers.dead", summary.dead())
                .withDetail("workers.unknown", summary.unknown())
                .build();
    }
}

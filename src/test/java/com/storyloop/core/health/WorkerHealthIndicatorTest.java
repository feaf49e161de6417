package com.storyloop.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkerHealthIndicatorTest {

    private final HealthMonitor monitor = mock(HealthMonitor.class);
    private final WorkerHealthIndicator indicator = new WorkerHealthIndicator(monitor);

    @Test
    @DisplayName("no workers -> UP")
    void noWorkersIsUp() {
        when(monitor.summary()).thenReturn(new HealthSummary(0, 0, 0, 0, 0));

        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(0, health.getDetails().get("workers.total"));
    }

    @Test
    @DisplayName("hung worker -> DEGRADED")
    void hungWorkerIsDegraded() {
        when(monitor.summary()).thenReturn(new HealthSummary(2, 1, 1, 0, 0));

        var health = indicator.health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertEquals(1, health.getDetails().get("workers.hung"));
    }

    @Test
    @DisplayName("dead worker -> DOWN")
    void deadWorkerIsDown() {
        when(monitor.summary()).thenReturn(new HealthSummary(3, 1, 1, 1, 0));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("unreadable state -> UNKNOWN with reason")
    void failureIsUnknown() {
        when(monitor.summary()).thenThrow(new IllegalStateException("disk gone"));

        var health = indicator.health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals("disk gone", health.getDetails().get("reason"));
    }
}

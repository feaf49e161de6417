package com.storyloop.dispatch.cli;

import com.storyloop.core.health.HealthMonitor;
import com.storyloop.core.health.HealthSummary;
import com.storyloop.core.health.WorkerHealth;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: storyloop health
 * <p>
 * Classifies worker heartbeats. Exits with 1 when any worker is HUNG or DEAD.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check worker health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = "--worker", description = "Check a single worker")
    private String workerId;

    @Option(names = "--summary", description = "Show counts by status only")
    private boolean summary;

    @Option(names = "--cleanup", paramLabel = "HOURS", description = "Remove heartbeat records older than HOURS")
    private Double cleanupHours;

    private final HealthMonitor healthMonitor;

    public HealthCommand(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Integer call() {
        if (cleanupHours != null) {
            List<String> removed = healthMonitor.cleanup(cleanupHours);
            ConsoleOutput.success("Removed " + removed.size() + " stale heartbeat record(s)");
            return 0;
        }
        if (workerId != null) {
            WorkerHealth health = healthMonitor.check(workerId);
            ConsoleOutput.worker(health);
            return health.status().isUnhealthy() ? 1 : 0;
        }
        if (summary) {
            HealthSummary s = healthMonitor.summary();
            ConsoleOutput.info("Workers: " + s.total() + " (healthy " + s.healthy() + ", hung " + s.hung()
                    + ", dead " + s.dead() + ", unknown " + s.unknown() + ")");
            return s.hung() + s.dead() > 0 ? 1 : 0;
        }

        Map<String, WorkerHealth> all = healthMonitor.checkAll();
        if (all.isEmpty()) {
            ConsoleOutput.info("No active workers");
            return 0;
        }
        boolean allHealthy = true;
        for (WorkerHealth health : all.values()) {
            ConsoleOutput.worker(health);
            allHealthy &= !health.status().isUnhealthy();
        }
        System.out.println("──────────────────────────────────");
        if (allHealthy) {
            ConsoleOutput.success("Overall: no hung or dead workers");
        } else {
            ConsoleOutput.error("Overall: one or more workers hung or dead");
        }
        return allHealthy ? 0 : 1;
    }
}

package com.storyloop.dispatch.cli;

import com.storyloop.config.LoopProperties;
import com.storyloop.core.health.HealthMonitor;
import com.storyloop.core.merge.MergeController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;

/**
 * CLI command: storyloop cleanup
 * <p>
 * Recovery sweep for worker branches, worktrees and heartbeats left behind by a crash.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Remove abandoned worker state")
@Component
public class CleanupCommand implements Runnable {

    @Option(names = "--older-than-hours", defaultValue = "24",
            description = "Treat workers idle longer than this as abandoned (default: ${DEFAULT-VALUE})")
    private double olderThanHours;

    @Option(names = "--merged", description = "Also delete worker branches already merged into the base branch")
    private boolean merged;

    private final MergeController mergeController;
    private final HealthMonitor healthMonitor;
    private final LoopProperties properties;

    public CleanupCommand(MergeController mergeController, HealthMonitor healthMonitor, LoopProperties properties) {
        this.mergeController = mergeController;
        this.healthMonitor = healthMonitor;
        this.properties = properties;
    }

    @Override
    public void run() {
        Duration maxAge = Duration.ofSeconds((long) (olderThanHours * 3600));
        List<String> workspaces = mergeController.cleanup(maxAge);
        ConsoleOutput.success("Removed " + workspaces.size() + " abandoned worker branch(es)/worktree(s)");
        List<String> heartbeats = healthMonitor.cleanup(olderThanHours);
        ConsoleOutput.success("Removed " + heartbeats.size() + " stale heartbeat record(s)");
        if (merged) {
            List<String> branches = mergeController.cleanupMerged(properties.getBaseBranch());
            ConsoleOutput.success("Deleted " + branches.size() + " merged worker branch(es)");
        }
    }
}

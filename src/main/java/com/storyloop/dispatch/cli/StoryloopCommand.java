package com.storyloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for storyloop.
 * Routes to subcommands: plan, cycles, conflicts, run, health, retries, cleanup.
 */
@Command(
        name = "storyloop",
        mixinStandardHelpOptions = true,
        version = "storyloop 0.1.0",
        description = "Parallel story execution engine for autonomous coding loops",
        subcommands = {
                PlanCommand.class,
                CyclesCommand.class,
                ConflictsCommand.class,
                RunCommand.class,
                HealthCommand.class,
                RetriesCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StoryloopCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

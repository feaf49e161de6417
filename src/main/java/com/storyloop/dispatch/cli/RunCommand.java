package com.storyloop.dispatch.cli;

import com.storyloop.core.engine.BatchOrchestrator;
import com.storyloop.core.graph.GraphException;
import com.storyloop.core.merge.ConflictException;
import com.storyloop.core.model.RunReport;
import com.storyloop.prd.PrdTaskSource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: storyloop run [prd.json]
 * <p>
 * Executes every incomplete story. Exits with 0 only when all of them merged.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute stories in parallel batches")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = "prd.json", description = "Requirements document (default: ${DEFAULT-VALUE})")
    private Path prd;

    private final PrdTaskSource taskSource;
    private final BatchOrchestrator orchestrator;

    public RunCommand(PrdTaskSource taskSource, BatchOrchestrator orchestrator) {
        this.taskSource = taskSource;
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        RunReport report;
        try {
            report = orchestrator.run(taskSource.load(prd));
        } catch (GraphException | ConflictException e) {
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return 2;
        }
        ConsoleOutput.report(report);
        return report.allMerged() ? 0 : 1;
    }
}

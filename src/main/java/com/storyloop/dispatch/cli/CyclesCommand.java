package com.storyloop.dispatch.cli;

import com.storyloop.core.graph.DependencyGraph;
import com.storyloop.core.graph.GraphException;
import com.storyloop.core.state.StateFiles;
import com.storyloop.prd.PrdTaskSource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: storyloop cycles [prd.json]
 * <p>
 * Exits with 1 when the dependency graph has cycles or unknown references.
 */
@Command(name = "cycles", mixinStandardHelpOptions = true, description = "Check the dependency graph for cycles")
@Component
public class CyclesCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = "prd.json", description = "Requirements document (default: ${DEFAULT-VALUE})")
    private Path prd;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    private final PrdTaskSource taskSource;
    private final StateFiles stateFiles;

    public CyclesCommand(PrdTaskSource taskSource, StateFiles stateFiles) {
        this.taskSource = taskSource;
        this.stateFiles = stateFiles;
    }

    @Override
    public Integer call() throws Exception {
        List<List<String>> cycles;
        try {
            DependencyGraph graph = DependencyGraph.build(taskSource.load(prd));
            cycles = graph.detectCycles(graph.ids(false));
        } catch (GraphException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (json) {
            System.out.println(stateFiles.mapper().writerWithDefaultPrettyPrinter()
                    .writeValueAsString(Map.of("has_cycles", !cycles.isEmpty(), "cycles", cycles)));
        } else if (cycles.isEmpty()) {
            ConsoleOutput.success("No circular dependencies");
        } else {
            ConsoleOutput.error("Found " + cycles.size() + " circular dependency chain(s):");
            for (List<String> cycle : cycles) {
                System.out.println("    " + String.join(" -> ", cycle));
            }
        }
        return cycles.isEmpty() ? 0 : 1;
    }
}

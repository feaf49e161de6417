package com.storyloop.dispatch.cli;

import com.storyloop.core.graph.DependencyGraph;
import com.storyloop.core.graph.GraphException;
import com.storyloop.core.model.ExecutionPlan;
import com.storyloop.core.state.StateFiles;
import com.storyloop.prd.PrdTaskSource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: storyloop plan [prd.json]
 * <p>
 * Prints the parallel batch plan, as text or JSON.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the parallel execution plan")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = "prd.json", description = "Requirements document (default: ${DEFAULT-VALUE})")
    private Path prd;

    @Option(names = "--json", description = "Print the plan as JSON")
    private boolean json;

    @Option(names = "--all", description = "Include stories that already pass")
    private boolean all;

    private final PrdTaskSource taskSource;
    private final StateFiles stateFiles;

    public PlanCommand(PrdTaskSource taskSource, StateFiles stateFiles) {
        this.taskSource = taskSource;
        this.stateFiles = stateFiles;
    }

    @Override
    public Integer call() throws Exception {
        try {
            DependencyGraph graph = DependencyGraph.build(taskSource.load(prd));
            Set<String> subset = graph.ids(!all);
            if (json) {
                ExecutionPlan plan = graph.executionPlan(subset);
                System.out.println(stateFiles.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(plan));
            } else {
                System.out.print(graph.visualize(subset));
            }
            return 0;
        } catch (GraphException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}

package com.storyloop.dispatch.cli;

import com.storyloop.core.merge.FileScopeConflict;
import com.storyloop.core.merge.MergeController;
import com.storyloop.core.model.Task;
import com.storyloop.core.state.StateFiles;
import com.storyloop.prd.PrdTaskSource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: storyloop conflicts [prd.json]
 * <p>
 * Lists every pair of stories whose file scopes overlap. Exits with 1 when any exist.
 */
@Command(name = "conflicts", mixinStandardHelpOptions = true, description = "Detect file-scope conflicts between stories")
@Component
public class ConflictsCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = "prd.json", description = "Requirements document (default: ${DEFAULT-VALUE})")
    private Path prd;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Option(names = "--split", description = "Also show conflict-free parallel groups")
    private boolean split;

    @Option(names = "--all", description = "Include stories that already pass")
    private boolean all;

    private final PrdTaskSource taskSource;
    private final MergeController mergeController;
    private final StateFiles stateFiles;

    public ConflictsCommand(PrdTaskSource taskSource, MergeController mergeController, StateFiles stateFiles) {
        this.taskSource = taskSource;
        this.mergeController = mergeController;
        this.stateFiles = stateFiles;
    }

    @Override
    public Integer call() throws Exception {
        List<Task> tasks = taskSource.load(prd).stream()
                .filter(t -> all || !t.complete())
                .toList();
        List<FileScopeConflict> conflicts = mergeController.detectConflicts(tasks);

        if (json) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("has_conflicts", !conflicts.isEmpty());
            result.put("conflicts", conflicts);
            if (split) {
                result.put("groups", mergeController.splitParallelGroups(tasks));
            }
            System.out.println(stateFiles.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return conflicts.isEmpty() ? 0 : 1;
        }

        if (conflicts.isEmpty()) {
            ConsoleOutput.success("No file-scope conflicts among " + tasks.size() + " stories");
        } else {
            ConsoleOutput.error("Found " + conflicts.size() + " file-scope conflict(s):");
            for (FileScopeConflict conflict : conflicts) {
                System.out.println("    " + conflict.first() + " <-> " + conflict.second()
                        + ": " + String.join(", ", conflict.overlappingPaths()));
            }
        }
        if (split) {
            List<List<String>> groups = mergeController.splitParallelGroups(tasks);
            ConsoleOutput.info(groups.size() + " conflict-free group(s):");
            for (int i = 0; i < groups.size(); i++) {
                System.out.println("    Group " + (i + 1) + ": " + String.join(", ", groups.get(i)));
            }
        }
        return conflicts.isEmpty() ? 0 : 1;
    }
}

package com.storyloop.core.merge;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test subclass that intercepts git execution. Exit codes and outputs can be configured
 * per command prefix (e.g. {@code "rebase"}, {@code "worktree add"}); the longest matching
 * prefix wins.
 */
public class TestableGitWorkspaceManager extends GitWorkspaceManager {

    private final List<List<String>> executedCommands = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> exitCodes = new ConcurrentHashMap<>();
    private final Map<String, String> outputs = new ConcurrentHashMap<>();
    private volatile int defaultExitCode = 0;

    public TestableGitWorkspaceManager(Path repoPath) {
        super(repoPath);
    }

    public void setExitCode(int exitCode) {
        this.defaultExitCode = exitCode;
    }

    public void setExitCode(String commandPrefix, int exitCode) {
        exitCodes.put(commandPrefix, exitCode);
    }

    public void setGitOutput(String commandPrefix, String output) {
        outputs.put(commandPrefix, output);
    }

    public List<List<String>> getExecutedCommands() {
        return new ArrayList<>(executedCommands);
    }

    /** Commands rendered as {@code "git <args...>"}. */
    public List<String> commandLines() {
        return executedCommands.stream().map(c -> String.join(" ", c)).toList();
    }

    public boolean ran(String commandPrefix) {
        return commandLines().stream().anyMatch(c -> c.startsWith("git " + commandPrefix));
    }

    @Override
    int runGit(Path workDir, String... args) {
        record(args);
        Integer code = lookup(exitCodes, args);
        return code != null ? code : defaultExitCode;
    }

    @Override
    String runGitOutput(Path workDir, String... args) {
        record(args);
        String output = lookup(outputs, args);
        return output != null ? output : "";
    }

    private void record(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        executedCommands.add(command);
    }

    private static <T> T lookup(Map<String, T> table, String... args) {
        String line = String.join(" ", args);
        String best = null;
        for (String prefix : table.keySet()) {
            if (line.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best != null ? table.get(best) : null;
    }
}

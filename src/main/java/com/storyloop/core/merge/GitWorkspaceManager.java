package com.storyloop.core.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thin wrapper over the local {@code git} CLI for worker worktrees and merge-back.
 *
 * <p>This class shells out to {@code git} via {@link ProcessBuilder} rather than depending
 * on JGit. It makes no policy decisions; {@link MergeController} owns naming, locking and
 * error handling.
 */
public class GitWorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspaceManager.class);

    private final Path repoPath;

    public GitWorkspaceManager(Path repoPath) {
        this.repoPath = repoPath.toAbsolutePath().normalize();
    }

    public Path repoPath() {
        return repoPath;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // WORKTREES
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Creates a worktree at {@code worktreePath} with {@code branch} reset to the current
     * tip of {@code baseRef}. A stale directory or registration at that path is removed first.
     *
     * @return true if the worktree was created
     */
    public boolean addWorktree(Path worktreePath, String branch, String baseRef) {
        runGit(repoPath, "worktree", "prune");
        if (Files.exists(worktreePath)) {
            log.info("Removing stale worktree at {}", worktreePath);
            removeWorktree(worktreePath);
        }

        log.info("Adding worktree at {} (branch: {}, base: {})", worktreePath, branch, baseRef);
        int exitCode = runGit(repoPath, "worktree", "add", "-B", branch, worktreePath.toString(), baseRef);
        if (exitCode != 0) {
            log.error("Failed to create worktree for branch {} (exit code {})", branch, exitCode);
            return false;
        }
        return true;
    }

    /**
     * Removes a worktree, falling back to deleting the directory and pruning when
     * {@code git worktree remove} refuses.
     */
    public void removeWorktree(Path worktreePath) {
        // --force in case the agent left uncommitted changes
        int exitCode = runGit(repoPath, "worktree", "remove", "--force", worktreePath.toString());
        if (exitCode != 0) {
            log.warn("git worktree remove failed for {}, attempting manual cleanup", worktreePath);
            deleteDirectory(worktreePath);
            runGit(repoPath, "worktree", "prune");
        }
    }

    public void pruneWorktrees() {
        runGit(repoPath, "worktree", "prune");
    }

    /**
     * Stages and commits everything in the worktree.
     *
     * @return true if a commit was created, false if there was nothing to commit
     */
    public boolean commitAll(Path worktreePath, String message) {
        runGit(worktreePath, "add", "-A");
        int diffExit = runGit(worktreePath, "diff", "--cached", "--quiet");
        if (diffExit == 0) {
            return false;
        }
        int commitExit = runGit(worktreePath, "commit", "-m", message);
        if (commitExit != 0) {
            throw new IllegalStateException("git commit failed in " + worktreePath + " (exit code " + commitExit + ")");
        }
        return true;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // BRANCHES
    // ══════════════════════════════════════════════════════════════════════════

    public boolean deleteBranch(String branch) {
        int exitCode = runGit(repoPath, "branch", "-D", branch);
        if (exitCode != 0) {
            log.warn("Failed to delete branch {} (exit code {})", branch, exitCode);
            return false;
        }
        return true;
    }

    /**
     * Lists local branches under {@code prefix} with their tip commit time.
     */
    public Map<String, Instant> branchActivity(String prefix) {
        String output = runGitOutput(repoPath, "for-each-ref",
                "--format=%(refname:short) %(committerdate:unix)", "refs/heads/" + prefix);
        Map<String, Instant> result = new LinkedHashMap<>();
        for (String line : lines(output)) {
            int space = line.lastIndexOf(' ');
            if (space <= 0) {
                continue;
            }
            try {
                long epoch = Long.parseLong(line.substring(space + 1).trim());
                result.put(line.substring(0, space), Instant.ofEpochSecond(epoch));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparseable ref line '{}': {}", line, e.getMessage());
            }
        }
        return result;
    }

    /** Lists local branches under {@code prefix} already merged into {@code baseRef}. */
    public List<String> mergedBranches(String baseRef, String prefix) {
        String output = runGitOutput(repoPath, "branch", "--merged", baseRef,
                "--format=%(refname:short)", "--list", prefix + "*");
        return lines(output);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // MERGE-BACK
    // ══════════════════════════════════════════════════════════════════════════

    /** Paths changed on {@code branch} since it diverged from {@code baseRef}. */
    public List<String> changedFiles(String baseRef, String branch) {
        return lines(runGitOutput(repoPath, "diff", "--name-only", baseRef + "..." + branch));
    }

    /**
     * Rebases the branch checked out in {@code worktreePath} onto {@code onto}.
     *
     * @return true on a clean rebase, false if it stopped on conflicts
     */
    public boolean rebase(Path worktreePath, String onto) {
        return runGit(worktreePath, "rebase", onto) == 0;
    }

    /** Paths left unmerged by a stopped rebase. */
    public List<String> unmergedFiles(Path worktreePath) {
        return lines(runGitOutput(worktreePath, "diff", "--name-only", "--diff-filter=U"));
    }

    public void abortRebase(Path worktreePath) {
        int exitCode = runGit(worktreePath, "rebase", "--abort");
        if (exitCode != 0) {
            log.warn("git rebase --abort exited with {} in {}", exitCode, worktreePath);
        }
    }

    /**
     * Checks out {@code baseRef} in the main repository and fast-forwards it to {@code branch}.
     *
     * @return true if the base reference now points at the branch tip
     */
    public boolean fastForward(String baseRef, String branch) {
        if (runGit(repoPath, "checkout", baseRef) != 0) {
            log.error("Failed to check out {} in {}", baseRef, repoPath);
            return false;
        }
        return runGit(repoPath, "merge", "--ff-only", branch) == 0;
    }

    public String headCommit() {
        return runGitOutput(repoPath, "rev-parse", "HEAD").trim();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // PROCESS PLUMBING
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Runs a git command, streaming its combined output to debug logging.
     * Package-private so tests can intercept git execution.
     *
     * @return process exit code
     */
    int runGit(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            // Consume output to prevent blocking
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }

            return process.waitFor();
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new IllegalStateException("Git command failed: " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted running git " + String.join(" ", args), e);
        }
    }

    /**
     * Runs a git command and returns its standard output. A non-zero exit is logged,
     * not thrown; callers interpret empty output.
     */
    String runGitOutput(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Git command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return output;
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new IllegalStateException("Git command failed: " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted running git " + String.join(" ", args), e);
        }
    }

    private static List<String> buildCommand(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }

    private static List<String> lines(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        return output.lines()
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .toList();
    }

    static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (var walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not walk {} for deletion: {}", dir, e.getMessage());
        }
    }
}

package com.storyloop.core.merge;

import com.storyloop.core.metrics.LoopMetrics;
import com.storyloop.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Isolates workers in their own branch and worktree, detects file-scope conflicts, and
 * merges completed work back onto the base reference one task at a time.
 *
 * <p>Lifecycle per task attempt:
 * <ol>
 *   <li>{@link #createWorker} branches {@code <prefix><taskId>} from the current base tip</li>
 *   <li>the agent commits inside the worktree</li>
 *   <li>{@link #mergeBack} rebases onto the base tip and fast-forwards the base under the merge lock</li>
 *   <li>the worktree and branch are released; {@link #cleanup} sweeps anything a crash left behind</li>
 * </ol>
 */
public class MergeController {

    private static final Logger log = LoggerFactory.getLogger(MergeController.class);

    private final GitWorkspaceManager git;
    private final BaseRefLock baseRefLock;
    private final Path worktreesDir;
    private final String branchPrefix;
    private final Duration lockTimeout;
    private final LoopMetrics metrics;
    private final Clock clock;

    /** Maps taskId to its live workspace. */
    private final ConcurrentHashMap<String, WorkerWorkspace> workspaces = new ConcurrentHashMap<>();

    public MergeController(GitWorkspaceManager git, BaseRefLock baseRefLock, Path worktreesDir,
                           String branchPrefix, Duration lockTimeout, LoopMetrics metrics) {
        this(git, baseRefLock, worktreesDir, branchPrefix, lockTimeout, metrics, Clock.systemUTC());
    }

    public MergeController(GitWorkspaceManager git, BaseRefLock baseRefLock, Path worktreesDir,
                           String branchPrefix, Duration lockTimeout, LoopMetrics metrics, Clock clock) {
        this.git = git;
        this.baseRefLock = baseRefLock;
        this.worktreesDir = worktreesDir.toAbsolutePath().normalize();
        this.branchPrefix = branchPrefix;
        this.lockTimeout = lockTimeout;
        this.metrics = metrics;
        this.clock = clock;
    }

    public String branchName(String taskId) {
        return branchPrefix + sanitize(taskId);
    }

    Path worktreePath(String taskId) {
        return worktreesDir.resolve(sanitize(taskId));
    }

    // ══════════════════════════════════════════════════════════════════════════
    // CONFLICT DETECTION
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Splits a dependency batch by file scope. Members are claimed in the given order
     * (callers pass priority order); a member overlapping anything already claimed is
     * deferred to run alone after the parallel wave.
     */
    public ConflictCheck checkConflicts(List<Task> batch) {
        List<String> parallel = new ArrayList<>();
        List<String> deferred = new ArrayList<>();
        List<String> claimed = new ArrayList<>();

        for (Task task : batch) {
            if (FileScopes.disjoint(task.fileScope(), claimed)) {
                parallel.add(task.id());
                claimed.addAll(task.fileScope());
                log.debug("  {} claims files: {}", task.id(), task.fileScope());
            } else {
                log.info("  {} - file overlap with wave, deferring to sequential sub-batch (scope: {})",
                        task.id(), task.fileScope());
                deferred.add(task.id());
                if (metrics != null) {
                    metrics.recordFileScopeDeferral();
                }
            }
        }

        List<FileScopeConflict> conflicts = detectConflicts(batch);
        if (!deferred.isEmpty()) {
            log.info("File overlap: {} task(s) serialized due to file conflicts: {}", deferred.size(), deferred);
        }
        return new ConflictCheck(parallel, deferred, conflicts);
    }

    /** Every pair of tasks whose file scopes overlap, with the overlapping paths. */
    public List<FileScopeConflict> detectConflicts(Collection<Task> tasks) {
        List<Task> list = List.copyOf(tasks);
        List<FileScopeConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            for (int j = i + 1; j < list.size(); j++) {
                Task a = list.get(i);
                Task b = list.get(j);
                List<String> shared = FileScopes.intersection(a.fileScope(), b.fileScope());
                if (!shared.isEmpty()) {
                    conflicts.add(new FileScopeConflict(a.id(), b.id(), shared));
                }
            }
        }
        return conflicts;
    }

    public boolean canRunParallel(Collection<Task> tasks) {
        return detectConflicts(tasks).isEmpty();
    }

    /**
     * Greedy colouring into conflict-free groups: each task joins the first group it does
     * not overlap, or starts a new one.
     */
    public List<List<String>> splitParallelGroups(Collection<Task> tasks) {
        List<List<Task>> groups = new ArrayList<>();
        for (Task task : tasks) {
            List<Task> home = null;
            for (List<Task> group : groups) {
                boolean fits = group.stream().allMatch(member -> FileScopes.disjoint(member.fileScope(), task.fileScope()));
                if (fits) {
                    home = group;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                groups.add(home);
            }
            home.add(task);
        }
        return groups.stream()
                .map(group -> group.stream().map(Task::id).toList())
                .toList();
    }

    /**
     * Final guard before dispatching a wave concurrently.
     *
     * @throws ConflictException if any two tasks overlap
     */
    public void requireDisjoint(Collection<Task> tasks) {
        List<FileScopeConflict> conflicts = detectConflicts(tasks);
        if (!conflicts.isEmpty()) {
            throw new ConflictException(conflicts);
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // WORKER ISOLATION
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Creates an isolated worktree on a fresh branch from the current tip of {@code baseRef}.
     * The returned workspace must be closed; try-with-resources is the intended usage.
     *
     * @throws IllegalStateException if the task already has a live workspace or git fails
     */
    public WorkerWorkspace createWorker(Task task, String baseRef) {
        String branch = branchName(task.id());
        Path path = worktreePath(task.id());
        WorkerWorkspace workspace = new WorkerWorkspace(task.id(), branch, path, this);
        register(workspace);

        boolean created;
        try {
            created = git.addWorktree(path, branch, baseRef);
        } catch (RuntimeException e) {
            workspaces.remove(task.id(), workspace);
            recordWorktree("create", false);
            throw e;
        }
        if (!created) {
            workspaces.remove(task.id(), workspace);
            recordWorktree("create", false);
            throw new IllegalStateException("Failed to create worktree for " + task.id() + " from " + baseRef);
        }
        recordWorktree("create", true);
        log.info("Created worker workspace for {} at {} (branch: {})", task.id(), path, branch);
        return workspace;
    }

    private synchronized void register(WorkerWorkspace workspace) {
        if (workspaces.containsKey(workspace.taskId())) {
            throw new IllegalStateException("Task " + workspace.taskId() + " already has an active workspace");
        }
        for (WorkerWorkspace live : workspaces.values()) {
            if (live.branch().equals(workspace.branch()) || live.path().equals(workspace.path())) {
                throw new IllegalStateException("Task " + workspace.taskId() + " maps to " + workspace.branch()
                        + ", already in use by task " + live.taskId());
            }
        }
        workspaces.put(workspace.taskId(), workspace);
    }

    public Optional<WorkerWorkspace> workspace(String taskId) {
        return Optional.ofNullable(workspaces.get(taskId));
    }

    public int activeWorkspaces() {
        return workspaces.size();
    }

    /**
     * Commits anything the agent left uncommitted in the workspace.
     *
     * @return true if a commit was made
     */
    public boolean commitPending(WorkerWorkspace workspace, String message) {
        boolean committed = git.commitAll(workspace.path(), message);
        if (committed) {
            log.info("Committed pending changes for {}", workspace.taskId());
        }
        return committed;
    }

    /**
     * Releases the workspace of a task unconditionally, as done for DEAD or hung workers.
     */
    public void reclaim(String taskId) {
        WorkerWorkspace workspace = workspaces.get(taskId);
        if (workspace == null) {
            log.debug("Nothing to reclaim for {}", taskId);
            return;
        }
        log.warn("Reclaiming workspace of unresponsive worker for {}", taskId);
        release(workspace);
    }

    void release(WorkerWorkspace workspace) {
        if (!workspace.markReleased()) {
            return;
        }
        workspaces.remove(workspace.taskId(), workspace);
        boolean ok = true;
        try {
            git.removeWorktree(workspace.path());
            if (!workspace.isBranchPreserved()) {
                ok = git.deleteBranch(workspace.branch());
            } else {
                log.info("Keeping branch {} for manual resolution", workspace.branch());
            }
        } catch (RuntimeException e) {
            ok = false;
            log.error("Failed to release workspace for {}: {}", workspace.taskId(), e.getMessage(), e);
        }
        recordWorktree("release", ok);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // MERGE-BACK
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Rebases the task's branch onto the current tip of {@code baseRef} and fast-forwards
     * the base. The merge lock is held for the whole operation. On success the workspace
     * is released; on failure the branch is preserved and the worktree removed.
     *
     * @throws MergeException naming the task on rebase conflict, lock timeout or ff failure
     */
    public MergeResult mergeBack(Task task, String baseRef) {
        WorkerWorkspace workspace = workspaces.get(task.id());
        if (workspace == null) {
            throw new MergeException(task.id(), "No active workspace for " + task.id());
        }

        try (BaseRefLock.Lease lease = lockBase(task.id(), baseRef)) {
            log.info("Merging {} into {}", workspace.branch(), baseRef);
            if (!git.rebase(workspace.path(), baseRef)) {
                List<String> conflicting = git.unmergedFiles(workspace.path());
                git.abortRebase(workspace.path());
                throw conflict(workspace, "Rebase of " + workspace.branch() + " onto " + baseRef
                        + " hit conflicts in " + conflicting, conflicting);
            }

            List<String> files = git.changedFiles(baseRef, workspace.branch());
            if (!git.fastForward(baseRef, workspace.branch())) {
                throw conflict(workspace, "Fast-forward of " + baseRef + " to " + workspace.branch()
                        + " failed", List.of());
            }
            String commit = git.headCommit();

            release(workspace);
            if (metrics != null) {
                metrics.recordMergeResult("merged");
            }
            log.info("Merged {} ({} file(s)) -> {}", task.id(), files.size(), commit);
            return new MergeResult(task.id(), workspace.branch(), commit, files);
        }
    }

    private BaseRefLock.Lease lockBase(String taskId, String baseRef) {
        long waitStart = System.currentTimeMillis();
        try {
            BaseRefLock.Lease lease = baseRefLock.acquire(baseRef, lockTimeout);
            if (metrics != null) {
                metrics.recordLockWait(System.currentTimeMillis() - waitStart);
            }
            return lease;
        } catch (TimeoutException e) {
            throw new MergeException(taskId, e.getMessage(), List.of(), e);
        }
    }

    private MergeException conflict(WorkerWorkspace workspace, String message, List<String> files) {
        log.warn("Merge failed for {}: {}", workspace.taskId(), message);
        workspace.preserveBranch();
        release(workspace);
        if (metrics != null) {
            metrics.recordMergeResult("conflicted");
        }
        return new MergeException(workspace.taskId(), message, files, null);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // RECOVERY
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Removes worker branches and worktrees whose last activity is older than {@code maxAge},
     * skipping anything owned by a live workspace.
     *
     * @return branch names (or orphaned worktree directories) removed
     */
    public List<String> cleanup(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> removed = new ArrayList<>();
        git.pruneWorktrees();

        for (Map.Entry<String, Instant> entry : git.branchActivity(branchPrefix).entrySet()) {
            String branch = entry.getKey();
            if (isActiveBranch(branch) || !entry.getValue().isBefore(cutoff)) {
                continue;
            }
            Path path = worktreesDir.resolve(branch.substring(branchPrefix.length()));
            if (path.toFile().exists()) {
                git.removeWorktree(path);
            }
            if (git.deleteBranch(branch)) {
                removed.add(branch);
                log.info("Removed abandoned worker branch {} (last activity {})", branch, entry.getValue());
            }
        }

        File[] dirs = worktreesDir.toFile().listFiles(File::isDirectory);
        if (dirs != null) {
            for (File dir : dirs) {
                boolean active = workspaces.values().stream().anyMatch(w -> w.path().equals(dir.toPath()));
                if (!active && Instant.ofEpochMilli(dir.lastModified()).isBefore(cutoff)) {
                    git.removeWorktree(dir.toPath());
                    removed.add(dir.getName());
                    log.info("Removed orphaned worktree {}", dir);
                }
            }
        }
        recordWorktree("cleanup", true);
        return removed;
    }

    /**
     * Deletes worker branches already merged into {@code baseRef}.
     *
     * @return branch names deleted
     */
    public List<String> cleanupMerged(String baseRef) {
        List<String> removed = new ArrayList<>();
        for (String branch : git.mergedBranches(baseRef, branchPrefix)) {
            if (isActiveBranch(branch)) {
                continue;
            }
            if (git.deleteBranch(branch)) {
                removed.add(branch);
            }
        }
        log.info("Deleted {} merged worker branch(es)", removed.size());
        return removed;
    }

    private boolean isActiveBranch(String branch) {
        return workspaces.values().stream().anyMatch(w -> w.branch().equals(branch));
    }

    private void recordWorktree(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordWorktreeOperation(operation, success);
        }
    }

    /**
     * Ids that are already branch-safe are used as is. Anything else gets its unsafe characters
     * replaced plus a hash of the raw id, so {@code US 1/x} and {@code US-1-x} stay distinct.
     */
    static String sanitize(String taskId) {
        String safe = taskId.replaceAll("[^A-Za-z0-9._-]", "-");
        return safe.equals(taskId) ? safe : safe + "-" + String.format("%08x", taskId.hashCode());
    }
}

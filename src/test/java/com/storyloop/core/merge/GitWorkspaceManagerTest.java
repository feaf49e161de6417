package com.storyloop.core.merge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitWorkspaceManager}.
 *
 * <p>Uses a test subclass to intercept git commands, so command construction and output
 * parsing are verified without a real repository.
 */
class GitWorkspaceManagerTest {

    @TempDir
    Path tempDir;

    private TestableGitWorkspaceManager git;

    @BeforeEach
    void setUp() {
        git = new TestableGitWorkspaceManager(tempDir);
    }

    // --- worktrees ---

    @Test
    void addWorktreePrunesThenBranchesFromBase() {
        Path worktree = tempDir.resolve("worktrees/US-001");

        assertTrue(git.addWorktree(worktree, "worker/US-001", "main"));

        var commands = git.getExecutedCommands();
        assertEquals(List.of("git", "worktree", "prune"), commands.get(0));
        assertEquals(List.of("git", "worktree", "add", "-B", "worker/US-001", worktree.toString(), "main"),
                commands.get(1));
    }

    @Test
    void addWorktreeRemovesStaleDirectoryFirst() throws Exception {
        Path worktree = Files.createDirectories(tempDir.resolve("worktrees/US-001"));

        git.addWorktree(worktree, "worker/US-001", "main");

        assertTrue(git.ran("worktree remove --force " + worktree));
    }

    @Test
    void addWorktreeReportsFailure() {
        git.setExitCode("worktree add", 128);

        assertFalse(git.addWorktree(tempDir.resolve("wt"), "worker/US-001", "main"));
    }

    @Test
    void removeWorktreeFallsBackToDeletingDirectory() throws Exception {
        Path worktree = Files.createDirectories(tempDir.resolve("wt/nested"));
        Files.writeString(worktree.resolve("file.txt"), "left behind");
        git.setExitCode("worktree remove", 1);

        git.removeWorktree(tempDir.resolve("wt"));

        assertFalse(Files.exists(tempDir.resolve("wt")));
        List<String> lines = git.commandLines();
        assertEquals("git worktree prune", lines.get(lines.size() - 1));
    }

    @Test
    void commitAllSkipsWhenNothingStaged() {
        git.setExitCode("diff --cached --quiet", 0);

        assertFalse(git.commitAll(tempDir, "storyloop: US-001"));
        assertFalse(git.ran("commit"));
    }

    @Test
    void commitAllCommitsStagedChanges() {
        git.setExitCode("diff --cached --quiet", 1);

        assertTrue(git.commitAll(tempDir, "storyloop: US-001"));
        assertTrue(git.ran("commit -m storyloop: US-001"));
    }

    @Test
    void commitAllThrowsWhenCommitFails() {
        git.setExitCode("diff --cached --quiet", 1);
        git.setExitCode("commit", 1);

        assertThrows(IllegalStateException.class, () -> git.commitAll(tempDir, "msg"));
    }

    // --- branches ---

    @Test
    void branchActivityParsesRefLines() {
        git.setGitOutput("for-each-ref", "worker/US-001 1700000000\nworker/US-002 1700000600\ngarbage\n");

        Map<String, Instant> activity = git.branchActivity("worker/");

        assertEquals(2, activity.size());
        assertEquals(Instant.ofEpochSecond(1700000000L), activity.get("worker/US-001"));
        assertEquals(Instant.ofEpochSecond(1700000600L), activity.get("worker/US-002"));
    }

    @Test
    void mergedBranchesTrimsBlankLines() {
        git.setGitOutput("branch --merged", "  worker/US-001\n\n  worker/US-003 \n");

        assertEquals(List.of("worker/US-001", "worker/US-003"), git.mergedBranches("main", "worker/"));
    }

    // --- merge-back ---

    @Test
    void changedFilesUsesThreeDotDiff() {
        git.setGitOutput("diff --name-only main...worker/US-001", "src/a.py\nsrc/b.py");

        assertEquals(List.of("src/a.py", "src/b.py"), git.changedFiles("main", "worker/US-001"));
    }

    @Test
    void rebaseReportsConflicts() {
        git.setExitCode("rebase", 1);

        assertFalse(git.rebase(tempDir, "main"));
    }

    @Test
    void fastForwardStopsWhenCheckoutFails() {
        git.setExitCode("checkout", 1);

        assertFalse(git.fastForward("main", "worker/US-001"));
        assertFalse(git.ran("merge"));
    }

    @Test
    void fastForwardUsesFfOnly() {
        assertTrue(git.fastForward("main", "worker/US-001"));
        assertTrue(git.ran("merge --ff-only worker/US-001"));
    }

    @Test
    void headCommitIsTrimmed() {
        git.setGitOutput("rev-parse HEAD", "abc123\n");

        assertEquals("abc123", git.headCommit());
    }
}

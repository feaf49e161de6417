package com.storyloop.core.scheduler;

import com.storyloop.core.graph.DependencyGraph;
import com.storyloop.core.graph.GraphException;
import com.storyloop.core.merge.BaseRefLock;
import com.storyloop.core.merge.GitWorkspaceManager;
import com.storyloop.core.merge.MergeController;
import com.storyloop.core.model.Task;
import com.storyloop.core.model.Wave;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class TaskSchedulerTest {

    @TempDir
    Path tempDir;

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        var mergeController = new MergeController(mock(GitWorkspaceManager.class),
                new BaseRefLock(tempDir.resolve("locks")), tempDir.resolve("worktrees"),
                "worker/", Duration.ofSeconds(1), null);
        scheduler = new TaskScheduler(mergeController);
    }

    private static Task task(String id, List<String> deps, String... files) {
        return Task.of(id, 1, deps, Set.of(files));
    }

    private static List<List<String>> ids(List<Wave> waves) {
        return waves.stream().map(Wave::taskIds).toList();
    }

    @Test
    @DisplayName("conflicting ready tasks serialize and dependents wait for their batch")
    void conflictingTasksSerializeBeforeDependents() {
        var graph = DependencyGraph.build(List.of(
                task("A", List.of(), "src/a.py"),
                task("B", List.of("A")),
                task("C", List.of(), "src/a.py")));

        List<Wave> waves = scheduler.computeWaves(graph, graph.ids(false));

        assertEquals(List.of(List.of("A"), List.of("C"), List.of("B")), ids(waves));
        assertEquals("1", waves.get(0).label());
        assertEquals("1.1", waves.get(1).label());
        assertTrue(waves.get(1).isSequential());
        assertEquals(2, waves.get(2).batchNumber());
    }

    @Test
    @DisplayName("disjoint tasks stay in one parallel wave")
    void disjointTasksStayTogether() {
        var graph = DependencyGraph.build(List.of(
                task("A", List.of(), "src/a.py"),
                task("B", List.of(), "src/b.py"),
                task("C", List.of(), "docs/")));

        List<Wave> waves = scheduler.computeWaves(graph, graph.ids(false));

        assertEquals(List.of(List.of("A", "B", "C")), ids(waves));
        assertFalse(waves.get(0).isSequential());
    }

    @Test
    @DisplayName("conflicting tasks never share a wave")
    void conflictingTasksNeverShareWave() {
        var graph = DependencyGraph.build(List.of(
                task("A", List.of(), "src/core/"),
                task("B", List.of(), "src/core/Engine.java"),
                task("C", List.of(), "src/core/**/*.java"),
                task("D", List.of(), "README.md")));

        List<Wave> waves = scheduler.computeWaves(graph, graph.ids(false));

        for (Wave wave : waves) {
            boolean hasA = wave.taskIds().contains("A");
            assertFalse(hasA && wave.taskIds().contains("B"));
            assertFalse(hasA && wave.taskIds().contains("C"));
        }
        assertEquals(List.of(List.of("A", "D"), List.of("B"), List.of("C")), ids(waves));
    }

    @Test
    @DisplayName("cycles are fatal before any wave is produced")
    void cyclesAreFatal() {
        var graph = DependencyGraph.build(List.of(task("A", List.of("B")), task("B", List.of("A"))));

        assertThrows(GraphException.class, () -> scheduler.computeWaves(graph, graph.ids(false)));
    }

    @Test
    @DisplayName("empty subset yields no waves")
    void emptySubset() {
        var graph = DependencyGraph.build(List.of(task("A", List.of())));

        assertTrue(scheduler.computeWaves(graph, Set.of()).isEmpty());
    }
}

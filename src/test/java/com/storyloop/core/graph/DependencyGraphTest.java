package com.storyloop.core.graph;

import com.storyloop.core.model.ExecutionPlan;
import com.storyloop.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static Task task(String id, int priority, String... deps) {
        return Task.of(id, priority, List.of(deps), Set.of());
    }

    private static Task done(String id, String... deps) {
        return new Task(id, id, List.of(deps), Set.of(), 1, true);
    }

    private static Set<String> all(DependencyGraph graph) {
        return graph.ids(false);
    }

    // -- build ---------------------------------------------------------------

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("rejects unknown dependency references")
        void rejectsUnknownReferences() {
            var ex = assertThrows(GraphException.class, () -> DependencyGraph.build(List.of(
                    task("A", 1), task("B", 1, "A", "Z"))));

            assertEquals(List.of("Z"), ex.unknownReferences().get("B"));
            assertTrue(ex.getMessage().contains("Z"));
        }

        @Test
        @DisplayName("rejects duplicate ids")
        void rejectsDuplicateIds() {
            assertThrows(GraphException.class, () -> DependencyGraph.build(List.of(
                    task("A", 1), task("A", 2))));
        }

        @Test
        @DisplayName("records forward and reverse edges")
        void recordsEdges() {
            var graph = DependencyGraph.build(List.of(task("A", 1), task("B", 1, "A"), task("C", 1, "A")));

            assertEquals(Set.of("A"), graph.dependenciesOf("B"));
            assertEquals(Set.of("B", "C"), graph.dependentsOf("A"));
            assertEquals(3, graph.size());
        }

        @Test
        @DisplayName("task() rejects unknown ids")
        void taskRejectsUnknownIds() {
            var graph = DependencyGraph.build(List.of(task("A", 1)));
            assertThrows(IllegalArgumentException.class, () -> graph.task("B"));
        }
    }

    // -- detectCycles --------------------------------------------------------

    @Nested
    @DisplayName("detectCycles")
    class DetectCycles {

        @Test
        @DisplayName("returns nothing for a DAG")
        void noCyclesInDag() {
            var graph = DependencyGraph.build(List.of(task("A", 1), task("B", 1, "A"), task("C", 1, "B")));
            assertTrue(graph.detectCycles(all(graph)).isEmpty());
        }

        @Test
        @DisplayName("reports a two-node cycle closing on its start")
        void twoNodeCycle() {
            var graph = DependencyGraph.build(List.of(task("A", 1, "B"), task("B", 1, "A")));

            var cycles = graph.detectCycles(all(graph));

            assertEquals(1, cycles.size());
            assertEquals(List.of("A", "B", "A"), cycles.get(0));
        }

        @Test
        @DisplayName("a self-dependency is a length-1 cycle")
        void selfDependency() {
            var graph = DependencyGraph.build(List.of(task("A", 1, "A"), task("B", 1)));

            assertEquals(List.of(List.of("A", "A")), graph.detectCycles(all(graph)));
        }

        @Test
        @DisplayName("finds every independent cycle")
        void multipleCycles() {
            var graph = DependencyGraph.build(List.of(
                    task("A", 1, "B"), task("B", 1, "A"),
                    task("C", 1, "D"), task("D", 1, "C"),
                    task("E", 1)));

            assertEquals(2, graph.detectCycles(all(graph)).size());
        }

        @Test
        @DisplayName("walks very long dependency chains without deep recursion")
        void longChain() {
            // declared deepest first so the search descends the whole chain from its first root
            List<Task> chain = new ArrayList<>();
            for (int i = 99_999; i > 0; i--) {
                chain.add(task("T" + i, 1, "T" + (i - 1)));
            }
            chain.add(task("T0", 1));
            var graph = DependencyGraph.build(chain);

            assertTrue(graph.detectCycles(all(graph)).isEmpty());
        }

        @Test
        @DisplayName("reports the whole path of a cycle closing a chain")
        void cycleAtEndOfChain() {
            var graph = DependencyGraph.build(List.of(
                    task("A", 1, "D"), task("B", 1, "A"), task("C", 1, "B"), task("D", 1, "C")));

            List<List<String>> cycles = graph.detectCycles(all(graph));

            assertEquals(1, cycles.size());
            assertEquals(5, cycles.get(0).size());
            assertEquals(cycles.get(0).get(0), cycles.get(0).get(4));
        }

        @Test
        @DisplayName("ignores cycles outside the subset")
        void ignoresCyclesOutsideSubset() {
            var graph = DependencyGraph.build(List.of(task("A", 1, "B"), task("B", 1, "A"), task("C", 1)));

            assertTrue(graph.detectCycles(Set.of("A", "C")).isEmpty());
        }

        @Test
        @DisplayName("requireAcyclic throws carrying the cycles")
        void requireAcyclicThrows() {
            var graph = DependencyGraph.build(List.of(task("A", 1, "B"), task("B", 1, "A")));

            var ex = assertThrows(GraphException.class, () -> graph.requireAcyclic(all(graph)));
            assertEquals(1, ex.cycles().size());
        }
    }

    // -- topologicalOrder ----------------------------------------------------

    @Nested
    @DisplayName("topologicalOrder")
    class TopologicalOrder {

        @Test
        @DisplayName("every task appears once, after its dependencies")
        void respectsDependencies() {
            var graph = DependencyGraph.build(List.of(
                    task("D", 1, "B", "C"), task("B", 1, "A"), task("C", 1, "A"), task("A", 1)));

            List<String> order = graph.topologicalOrder(all(graph));

            assertEquals(4, order.size());
            assertEquals(4, new HashSet<>(order).size());
            for (String id : order) {
                for (String dep : graph.dependenciesOf(id)) {
                    assertTrue(order.indexOf(dep) < order.indexOf(id), dep + " before " + id);
                }
            }
        }

        @Test
        @DisplayName("breaks ties by priority, then declaration order")
        void tieBreaking() {
            var graph = DependencyGraph.build(List.of(task("X", 5), task("Y", 1), task("Z", 5)));

            assertEquals(List.of("Y", "X", "Z"), graph.topologicalOrder(all(graph)));
        }

        @Test
        @DisplayName("raises instead of dropping nodes on a cycle")
        void raisesOnCycle() {
            var graph = DependencyGraph.build(List.of(task("A", 1, "B"), task("B", 1, "A"), task("C", 1)));

            var ex = assertThrows(GraphException.class, () -> graph.topologicalOrder(all(graph)));
            assertEquals(Set.of("A", "B"), ex.unorderable());
        }
    }

    // -- parallelBatches -----------------------------------------------------

    @Nested
    @DisplayName("parallelBatches")
    class ParallelBatches {

        @Test
        @DisplayName("groups independent tasks and orders by priority")
        void groupsIndependentTasks() {
            var graph = DependencyGraph.build(List.of(
                    task("A", 2), task("B", 1), task("C", 1, "A", "B"), task("D", 3, "A")));

            assertEquals(List.of(List.of("B", "A"), List.of("C", "D")), graph.parallelBatches(all(graph)));
        }

        @Test
        @DisplayName("concatenation equals the topological order's set, no intra-batch edges")
        void consistentWithTopologicalOrder() {
            var graph = DependencyGraph.build(List.of(
                    task("A", 1), task("B", 2, "A"), task("C", 3, "A"), task("D", 1, "B", "C"), task("E", 1)));

            List<List<String>> batches = graph.parallelBatches(all(graph));
            List<String> flat = new ArrayList<>();
            batches.forEach(flat::addAll);

            assertEquals(new HashSet<>(graph.topologicalOrder(all(graph))), new HashSet<>(flat));
            assertEquals(flat.size(), new HashSet<>(flat).size());
            for (List<String> batch : batches) {
                for (String a : batch) {
                    for (String b : batch) {
                        assertFalse(graph.dependenciesOf(a).contains(b), a + " depends on " + b);
                    }
                }
            }
        }

        @Test
        @DisplayName("completed prerequisites outside the subset count as satisfied")
        void completedPrerequisitesSatisfied() {
            var graph = DependencyGraph.build(List.of(done("A"), task("B", 1, "A"), task("C", 1, "B")));

            Set<String> incomplete = graph.ids(true);

            assertEquals(Set.of("B", "C"), incomplete);
            assertEquals(List.of(List.of("B"), List.of("C")), graph.parallelBatches(incomplete));
        }

        @Test
        @DisplayName("empty subset yields no batches")
        void emptySubset() {
            var graph = DependencyGraph.build(List.of(task("A", 1)));
            assertTrue(graph.parallelBatches(Set.of()).isEmpty());
        }

        @Test
        @DisplayName("raises when nothing is ready")
        void raisesOnCycle() {
            var graph = DependencyGraph.build(List.of(task("A", 1, "B"), task("B", 1, "A")));
            assertThrows(GraphException.class, () -> graph.parallelBatches(all(graph)));
        }
    }

    // -- executionPlan / visualize -------------------------------------------

    @Nested
    @DisplayName("executionPlan and visualize")
    class PlanAndVisualize {

        @Test
        @DisplayName("aggregates batches with per-task metadata")
        void aggregates() {
            var graph = DependencyGraph.build(List.of(task("A", 1), task("B", 1), task("C", 1, "A")));

            ExecutionPlan plan = graph.executionPlan(all(graph));

            assertEquals(3, plan.totalTasks());
            assertEquals(2, plan.sequentialSteps());
            assertEquals(2, plan.maxParallelism());
            assertEquals(1, plan.batchOf("A"));
            assertEquals(2, plan.batchOf("C"));
            assertEquals(-1, plan.batchOf("missing"));
        }

        @Test
        @DisplayName("empty subset yields an empty plan")
        void emptyPlan() {
            var graph = DependencyGraph.build(List.of(task("A", 1)));

            ExecutionPlan plan = graph.executionPlan(Set.of());

            assertTrue(plan.isEmpty());
            assertEquals(0, plan.maxParallelism());
        }

        @Test
        @DisplayName("renders batches, markers, dependencies and speedup")
        void rendersText() {
            var graph = DependencyGraph.build(List.of(done("A"), task("B", 2, "A"), task("C", 3, "A")));

            String text = graph.visualize(all(graph));

            assertTrue(text.startsWith("Execution Plan Visualization\n"));
            assertTrue(text.contains("Batch 1 (can run in parallel):"));
            assertTrue(text.contains("[x] A: A"));
            assertTrue(text.contains("[ ] B: B"));
            assertTrue(text.contains("Depends on: A"));
            assertTrue(text.contains("Total: 3 tasks in 2 sequential batches"));
            assertTrue(text.contains("Max parallelism: 2 concurrent tasks"));
            assertTrue(text.contains("Speedup potential: 1.5x vs sequential"));
        }

        @Test
        @DisplayName("reports when there is nothing to display")
        void nothingToDisplay() {
            var graph = DependencyGraph.build(List.of(task("A", 1)));
            assertEquals("No tasks to display.", graph.visualize(Set.of()));
        }
    }
}

package com.storyloop.core.graph;

import com.storyloop.core.model.ExecutionPlan;
import com.storyloop.core.model.PlannedTask;
import com.storyloop.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Immutable task DAG built once per planning pass.
 *
 * <p>Every query takes the subset of task ids actually being scheduled. Dependencies that
 * point outside the subset (typically prerequisites already complete) count as satisfied.
 * Ties between ready tasks are broken by ascending priority, then declaration order, so
 * the same input always yields the same plan.
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private enum Colour { WHITE, GREY, BLACK }

    private final Map<String, Task> tasks;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final Comparator<String> readyOrder;

    private DependencyGraph(Map<String, Task> tasks,
                            Map<String, Set<String>> dependencies,
                            Map<String, Set<String>> dependents) {
        this.tasks = tasks;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.declarationIndex = new HashMap<>();
        int i = 0;
        for (String id : tasks.keySet()) {
            declarationIndex.put(id, i++);
        }
        this.readyOrder = Comparator
                .comparingInt((String id) -> this.tasks.get(id).priority())
                .thenComparingInt(declarationIndex::get);
    }

    /**
     * Builds the graph, validating that every declared dependency names a known task.
     *
     * @throws GraphException on duplicate ids or unknown references
     */
    public static DependencyGraph build(Collection<Task> input) {
        Map<String, Task> byId = new LinkedHashMap<>();
        for (Task task : input) {
            if (byId.putIfAbsent(task.id(), task) != null) {
                throw GraphException.duplicateId(task.id());
            }
        }

        Map<String, List<String>> unknown = new LinkedHashMap<>();
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            reverse.put(id, new LinkedHashSet<>());
        }
        for (Task task : byId.values()) {
            Set<String> own = new LinkedHashSet<>();
            for (String dep : task.dependencies()) {
                if (!byId.containsKey(dep)) {
                    unknown.computeIfAbsent(task.id(), k -> new ArrayList<>()).add(dep);
                    continue;
                }
                own.add(dep);
                reverse.get(dep).add(task.id());
            }
            deps.put(task.id(), Collections.unmodifiableSet(own));
        }
        if (!unknown.isEmpty()) {
            throw GraphException.unknownReferences(unknown);
        }

        reverse.replaceAll((id, set) -> Collections.unmodifiableSet(set));
        log.debug("Built dependency graph with {} tasks", byId.size());
        return new DependencyGraph(Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(deps), Collections.unmodifiableMap(reverse));
    }

    public int size() {
        return tasks.size();
    }

    public Task task(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return task;
    }

    public Collection<Task> tasks() {
        return tasks.values();
    }

    public Set<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    public Set<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, Set.of());
    }

    /**
     * Returns task ids in declaration order, optionally excluding tasks already complete.
     */
    public Set<String> ids(boolean incompleteOnly) {
        Set<String> ids = new LinkedHashSet<>();
        for (Task task : tasks.values()) {
            if (!incompleteOnly || !task.complete()) {
                ids.add(task.id());
            }
        }
        return ids;
    }

    /**
     * Depth-first search with three colours over the subset. Each returned cycle is the
     * id sequence along the back edge, closing on its first element; a self-dependency
     * yields {@code [A, A]}.
     *
     * @return every cycle found, empty when the subset is acyclic
     */
    public List<List<String>> detectCycles(Set<String> subset) {
        Set<String> scope = restrict(subset);
        Map<String, Colour> colour = new HashMap<>();
        for (String id : scope) {
            colour.put(id, Colour.WHITE);
        }
        List<List<String>> cycles = new ArrayList<>();
        for (String id : scope) {
            if (colour.get(id) == Colour.WHITE) {
                visit(id, scope, colour, new ArrayList<>(), cycles);
            }
        }
        if (!cycles.isEmpty()) {
            log.warn("Detected {} dependency cycle(s): {}", cycles.size(), cycles);
        }
        return cycles;
    }

    /**
     * Iterative so that long dependency chains cannot exhaust the call stack; {@code path}
     * mirrors the frames on the stack.
     */
    private void visit(String root, Set<String> scope, Map<String, Colour> colour,
                       List<String> path, List<List<String>> cycles) {
        Deque<Map.Entry<String, Iterator<String>>> stack = new ArrayDeque<>();
        colour.put(root, Colour.GREY);
        path.add(root);
        stack.push(Map.entry(root, dependencies.get(root).iterator()));

        while (!stack.isEmpty()) {
            Map.Entry<String, Iterator<String>> frame = stack.peek();
            Iterator<String> deps = frame.getValue();
            if (!deps.hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                colour.put(frame.getKey(), Colour.BLACK);
                continue;
            }
            String dep = deps.next();
            if (!scope.contains(dep)) {
                continue;
            }
            Colour c = colour.get(dep);
            if (c == Colour.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                cycles.add(List.copyOf(cycle));
            } else if (c == Colour.WHITE) {
                colour.put(dep, Colour.GREY);
                path.add(dep);
                stack.push(Map.entry(dep, dependencies.get(dep).iterator()));
            }
        }
    }

    /**
     * @throws GraphException carrying the cycles when the subset is not a DAG
     */
    public void requireAcyclic(Set<String> subset) {
        List<List<String>> cycles = detectCycles(subset);
        if (!cycles.isEmpty()) {
            throw GraphException.cycles(cycles);
        }
    }

    /**
     * Kahn's algorithm restricted to the subset.
     *
     * @throws GraphException if some tasks can never become ready
     */
    public List<String> topologicalOrder(Set<String> subset) {
        Set<String> scope = restrict(subset);
        Map<String, Integer> inDegree = inDegrees(scope);
        PriorityQueue<String> ready = new PriorityQueue<>(readyOrder);
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>(scope.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.get(id)) {
                if (inDegree.containsKey(dependent) && inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < scope.size()) {
            Set<String> remaining = new LinkedHashSet<>(scope);
            order.forEach(remaining::remove);
            throw GraphException.unorderable(remaining);
        }
        return order;
    }

    /**
     * Repeatedly extracts the set of tasks whose in-subset dependencies are all satisfied.
     * Each batch is sorted by priority.
     *
     * @throws GraphException if a step finds nothing ready while tasks remain
     */
    public List<List<String>> parallelBatches(Set<String> subset) {
        Set<String> remaining = restrict(subset);
        Map<String, Integer> inDegree = inDegrees(remaining);

        List<List<String>> batches = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<String> batch = new ArrayList<>();
            for (String id : remaining) {
                if (inDegree.get(id) == 0) {
                    batch.add(id);
                }
            }
            if (batch.isEmpty()) {
                throw GraphException.unorderable(remaining);
            }
            batch.sort(readyOrder);
            for (String id : batch) {
                remaining.remove(id);
                for (String dependent : dependents.get(id)) {
                    inDegree.computeIfPresent(dependent, (k, v) -> v - 1);
                }
            }
            batches.add(List.copyOf(batch));
        }
        return batches;
    }

    /** Aggregates {@link #parallelBatches} with per-task metadata. */
    public ExecutionPlan executionPlan(Set<String> subset) {
        List<List<String>> batches = parallelBatches(subset);
        if (batches.isEmpty()) {
            return ExecutionPlan.empty();
        }
        List<PlannedTask> details = new ArrayList<>();
        int maxWidth = 0;
        for (int i = 0; i < batches.size(); i++) {
            List<String> batch = batches.get(i);
            maxWidth = Math.max(maxWidth, batch.size());
            for (String id : batch) {
                details.add(PlannedTask.of(tasks.get(id), i + 1));
            }
        }
        log.info("Execution plan: {} tasks in {} batches, max parallelism {}",
                details.size(), batches.size(), maxWidth);
        return new ExecutionPlan(batches, details.size(), batches.size(), maxWidth, details);
    }

    /** Renders the batch plan as plain text for terminals and logs. */
    public String visualize(Set<String> subset) {
        List<List<String>> batches = parallelBatches(subset);
        if (batches.isEmpty()) {
            return "No tasks to display.";
        }
        String rule = "=".repeat(60);
        StringBuilder sb = new StringBuilder();
        sb.append("Execution Plan Visualization\n").append(rule).append("\n\n");
        int total = 0;
        int maxWidth = 0;
        for (int i = 0; i < batches.size(); i++) {
            List<String> batch = batches.get(i);
            total += batch.size();
            maxWidth = Math.max(maxWidth, batch.size());
            sb.append("Batch ").append(i + 1).append(" (can run in parallel):\n");
            sb.append("-".repeat(40)).append('\n');
            for (String id : batch) {
                Task task = tasks.get(id);
                String title = task.title().length() > 35 ? task.title().substring(0, 35) : task.title();
                sb.append("  ").append(task.complete() ? "[x] " : "[ ] ")
                        .append(id).append(": ").append(title).append('\n');
                sb.append("      Priority: ").append(task.priority());
                if (!task.fileScope().isEmpty()) {
                    sb.append(" | Files: ").append(String.join(", ", task.fileScope()));
                }
                sb.append('\n');
                if (!task.dependencies().isEmpty()) {
                    sb.append("      Depends on: ").append(String.join(", ", task.dependencies())).append('\n');
                }
            }
            sb.append('\n');
        }
        sb.append(rule).append('\n');
        sb.append("Total: ").append(total).append(" tasks in ").append(batches.size())
                .append(" sequential batches\n");
        sb.append("Max parallelism: ").append(maxWidth).append(" concurrent tasks\n");
        sb.append(String.format(Locale.ROOT, "Speedup potential: %.1fx vs sequential",
                (double) total / batches.size())).append('\n');
        return sb.toString();
    }

    private Set<String> restrict(Set<String> subset) {
        Set<String> scope = new LinkedHashSet<>();
        // iterate in declaration order regardless of the caller's set ordering
        for (String id : tasks.keySet()) {
            if (subset.contains(id)) {
                scope.add(id);
            }
        }
        return scope;
    }

    private Map<String, Integer> inDegrees(Set<String> scope) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : scope) {
            int degree = 0;
            for (String dep : dependencies.get(id)) {
                if (scope.contains(dep)) {
                    degree++;
                }
            }
            inDegree.put(id, degree);
        }
        return inDegree;
    }
}

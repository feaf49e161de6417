package com.storyloop.core.graph;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fatal planning error: the declared dependencies cannot be turned into an execution order.
 * Raised before any worker is dispatched.
 */
public class GraphException extends RuntimeException {

    private final List<List<String>> cycles;
    private final Map<String, List<String>> unknownReferences;
    private final Set<String> unorderable;

    private GraphException(String message, List<List<String>> cycles,
                           Map<String, List<String>> unknownReferences, Set<String> unorderable) {
        super(message);
        this.cycles = List.copyOf(cycles);
        this.unknownReferences = Map.copyOf(unknownReferences);
        this.unorderable = Set.copyOf(unorderable);
    }

    static GraphException unknownReferences(Map<String, List<String>> unknown) {
        return new GraphException("Unknown dependency references: " + unknown,
                List.of(), unknown, Set.of());
    }

    static GraphException duplicateId(String id) {
        return new GraphException("Duplicate task id: " + id, List.of(), Map.of(), Set.of());
    }

    static GraphException cycles(List<List<String>> cycles) {
        return new GraphException("Circular dependencies detected: " + cycles,
                cycles, Map.of(), Set.of());
    }

    static GraphException unorderable(Set<String> remaining) {
        return new GraphException("Circular dependency detected among tasks: " + remaining,
                List.of(), Map.of(), remaining);
    }

    /** Cycles found, each closing back on its first element. Empty for other causes. */
    public List<List<String>> cycles() {
        return cycles;
    }

    /** Task id to the dependency ids it declares that do not exist. */
    public Map<String, List<String>> unknownReferences() {
        return unknownReferences;
    }

    /** Tasks left over when ordering stalled. */
    public Set<String> unorderable() {
        return unorderable;
    }
}

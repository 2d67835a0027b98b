package com.hcltech.stackorder.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class Topo {
    private static final Logger log = LoggerFactory.getLogger(Topo.class);

    private Topo() {}

    /**
     * Depth-first postorder over an already validated graph: every dependency precedes its dependents,
     * unrelated stacks keep insertion order. {@link SortOrder#REVERSE} reverses the finished list.
     *
     * @throws IllegalStateException if a node is re-entered while still being visited, meaning
     *                               {@link CycleValidator#validate} was skipped on a cyclic graph
     */
    public static List<StackNode> order(StackGraph graph, SortOrder sortOrder) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(sortOrder, "sortOrder");

        List<StackNode> sorted = new ArrayList<>(graph.size());
        Set<StackNode> visited = new HashSet<>();
        Set<StackNode> inProgress = new HashSet<>();
        for (StackNode node : graph.nodes()) {
            visit(node, visited, inProgress, sorted);
        }
        if (sortOrder == SortOrder.REVERSE) Collections.reverse(sorted);
        log.debug("{} order: {}", sortOrder, sorted);
        return sorted;
    }

    /** {@link #order} rendered as plan entries with 1-based positions. */
    public static List<OrderedStack> ordered(StackGraph graph, SortOrder sortOrder) {
        List<StackNode> sorted = order(graph, sortOrder);
        List<OrderedStack> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            out.add(OrderedStack.of(sorted.get(i), i + 1));
        }
        return out;
    }

    /** Convenience: validate (throws on cycles), then order. */
    public static List<OrderedStack> validateAndOrder(StackGraph graph, SortOrder sortOrder) {
        CycleValidator.validate(graph);
        return ordered(graph, sortOrder);
    }

    private static void visit(StackNode node, Set<StackNode> visited, Set<StackNode> inProgress, List<StackNode> sorted) {
        if (visited.contains(node)) return;
        if (!inProgress.add(node)) {
            throw new IllegalStateException("Cycle detected at " + node.id() + "; validate the graph before ordering it");
        }
        for (StackNode dep : node.dependsOn()) {
            visit(dep, visited, inProgress, sorted);
        }
        inProgress.remove(node);
        visited.add(node);
        sorted.add(node);
    }
}

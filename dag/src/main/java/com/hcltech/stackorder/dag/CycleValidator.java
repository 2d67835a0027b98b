package com.hcltech.stackorder.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Proves a {@link StackGraph} is acyclic with a depth-first search from every node, in insertion order.
 * <p>
 * {@code finished} spans the whole pass. The current path is pushed on entry and popped on exit,
 * so it only ever holds the nodes between the root and the node being visited.
 */
public final class CycleValidator {
    private static final Logger log = LoggerFactory.getLogger(CycleValidator.class);

    private CycleValidator() {}

    /**
     * @throws CycleDetectedException naming the edge that closed the first cycle found
     */
    public static void validate(StackGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Set<StackNode> finished = new HashSet<>();
        for (StackNode root : graph.nodes()) {
            if (!finished.contains(root)) {
                visit(root, new LinkedHashSet<>(), finished);
            }
        }
        log.debug("No cycles among {} stacks", graph.size());
    }

    private static void visit(StackNode node, Set<StackNode> path, Set<StackNode> finished) {
        path.add(node);
        for (StackNode dep : node.dependsOn()) {
            if (finished.contains(dep)) continue;
            if (path.contains(dep)) {
                var ids = new ArrayList<String>(path.size());
                for (StackNode n : path) ids.add(n.id());
                log.debug("Cycle closed by {} -> {} while walking {}", node.id(), dep.id(), ids);
                throw new CycleDetectedException(node.id(), dep.id(), ids);
            }
            visit(dep, path, finished);
        }
        path.remove(node);
        finished.add(node);
    }
}

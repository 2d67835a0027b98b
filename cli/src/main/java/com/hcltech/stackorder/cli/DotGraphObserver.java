package com.hcltech.stackorder.cli;

import com.hcltech.stackorder.dag.GraphObserver;
import com.hcltech.stackorder.dag.StackNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Records graph construction events and renders them as a Graphviz {@code digraph}.
 * Edges point from a stack to the stack it depends on.
 */
public final class DotGraphObserver implements GraphObserver {
    private final List<String> nodes = new ArrayList<>();
    private final List<String[]> edges = new ArrayList<>();

    @Override
    public void onNodeCreated(StackNode node) {
        nodes.add(node.id());
    }

    @Override
    public void onEdgeAdded(StackNode from, StackNode to) {
        edges.add(new String[]{from.id(), to.id()});
    }

    public String toDot() {
        StringBuilder sb = new StringBuilder("digraph stacks {\n");
        for (String n : nodes) {
            sb.append("  ").append(quote(n)).append(";\n");
        }
        for (String[] e : edges) {
            sb.append("  ").append(quote(e[0])).append(" -> ").append(quote(e[1])).append(";\n");
        }
        return sb.append("}\n").toString();
    }

    private static String quote(String id) {
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}

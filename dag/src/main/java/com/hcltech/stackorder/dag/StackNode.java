package com.hcltech.stackorder.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One stack in a {@link StackGraph}. Identity is the graph slot, so equality is reference equality;
 * a graph never holds two nodes with the same {@link #id()}.
 */
public final class StackNode {
    private final String id;
    private final boolean hasBackingDirectory;
    private final List<StackNode> dependsOn = new ArrayList<>();
    private StackConfig config;

    StackNode(String id, StackConfig config, boolean hasBackingDirectory) {
        this.id = Objects.requireNonNull(id, "id");
        this.config = Objects.requireNonNull(config, "config");
        this.hasBackingDirectory = hasBackingDirectory;
    }

    public String id() {
        return id;
    }

    public StackConfig config() {
        return config;
    }

    public RunnerLabel runnerLabel() {
        return config.runnerLabel();
    }

    public boolean plannedChanges() {
        return config.plannedChanges();
    }

    public boolean skipWhenDestroying() {
        return config.skipWhenDestroying();
    }

    public boolean hasBackingDirectory() {
        return hasBackingDirectory;
    }

    /** Nodes that must be applied before this one, in declaration order. */
    public List<StackNode> dependsOn() {
        return Collections.unmodifiableList(dependsOn);
    }

    void config(StackConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** @return false if the edge was already present */
    boolean addDependency(StackNode dependency) {
        if (dependsOn.contains(dependency)) return false;
        dependsOn.add(dependency);
        return true;
    }

    @Override
    public String toString() {
        return id;
    }
}

package com.hcltech.stackorder.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable graph of stacks keyed by normalized identifier.
 * <p>
 * Nodes keep the order in which they were first mentioned, either by their own declaration or as
 * somebody's dependency. That order decides the relative position of unrelated stacks in
 * {@link Topo#order}. Not thread-safe: one graph is built and consumed by one caller per run.
 */
public final class StackGraph {
    private static final Logger log = LoggerFactory.getLogger(StackGraph.class);

    private final Path baseDirectory;
    private final DirectoryProbe probe;
    private final GraphObserver observer;
    private final Map<String, StackNode> nodes = new LinkedHashMap<>();

    public StackGraph(Path baseDirectory) {
        this(baseDirectory, DirectoryProbe.filesystem(), GraphObserver.NONE);
    }

    public StackGraph(Path baseDirectory, DirectoryProbe probe, GraphObserver observer) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Declares {@code stackId} with its dependencies and configuration.
     * <p>
     * An existing node (typically a placeholder created as someone's dependency) has its metadata
     * overwritten by {@code config}. Edges are appended after any earlier ones, skipping edges
     * that already exist.
     *
     * @throws UnknownDependencyException as soon as a dependency has no backing directory
     * @throws IllegalArgumentException   if an identifier is blank or leaves the base directory
     */
    public StackNode insert(String stackId, List<String> dependencyIds, StackConfig config) {
        Objects.requireNonNull(dependencyIds, "dependencyIds");
        Objects.requireNonNull(config, "config");
        String id = StackIds.normalize(stackId);

        StackNode node = nodes.get(id);
        if (node == null) {
            node = create(id, config);
        } else {
            merge(node, config);
        }

        for (String rawDep : dependencyIds) {
            String depId = StackIds.normalize(rawDep);
            StackNode dep = nodes.get(depId);
            if (dep == null) dep = create(depId, StackConfig.DEFAULTS);
            if (!dep.hasBackingDirectory()) {
                throw new UnknownDependencyException(id, depId);
            }
            if (node.addDependency(dep)) {
                log.debug("Added {} as dependency of {}", depId, id);
                observer.onEdgeAdded(node, dep);
            } else {
                log.debug("Ignoring repeated dependency {} of {}", depId, id);
            }
        }
        return node;
    }

    public Optional<StackNode> node(String stackId) {
        return Optional.ofNullable(nodes.get(StackIds.normalize(stackId)));
    }

    /** Insertion-ordered, unmodifiable view. */
    public Collection<StackNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    private StackNode create(String id, StackConfig config) {
        boolean hasDir = probe.hasDirectory(baseDirectory, id);
        StackNode node = new StackNode(id, config, hasDir);
        nodes.put(id, node);
        log.debug("{} was created as a node (directory present: {})", id, hasDir);
        observer.onNodeCreated(node);
        return node;
    }

    private static void merge(StackNode node, StackConfig incoming) {
        StackConfig current = node.config();
        if (current.runnerLabel() != incoming.runnerLabel()) {
            log.warn("{}: runner-label changed from {} to {}", node.id(), current.runnerLabel(), incoming.runnerLabel());
        }
        if (current.plannedChanges() != incoming.plannedChanges()) {
            log.warn("{}: planned-changes changed from {} to {}", node.id(), current.plannedChanges(), incoming.plannedChanges());
        }
        if (current.skipWhenDestroying() != incoming.skipWhenDestroying()) {
            log.warn("{}: skip_when_destroying changed from {} to {}", node.id(), current.skipWhenDestroying(), incoming.skipWhenDestroying());
        }
        node.config(incoming);
    }
}

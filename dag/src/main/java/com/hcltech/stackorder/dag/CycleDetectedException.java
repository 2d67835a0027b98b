package com.hcltech.stackorder.dag;

import java.util.List;

/**
 * The dependency relation contains a cycle. {@link #from()} and {@link #to()} are the edge that closed it.
 */
public class CycleDetectedException extends IllegalStateException {
    private final String from;
    private final String to;
    private final List<String> path;

    public CycleDetectedException(String from, String to, List<String> path) {
        super("Circular reference detected: " + from + " -> " + to);
        this.from = from;
        this.to = to;
        this.path = List.copyOf(path);
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    /** Traversal path from the root that was being explored down to {@link #from()}. */
    public List<String> path() {
        return path;
    }
}

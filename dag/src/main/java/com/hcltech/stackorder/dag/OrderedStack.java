package com.hcltech.stackorder.dag;

import java.util.Objects;

/** One entry of the final plan. {@code order} is 1-based. */
public record OrderedStack(String directory,
                           RunnerLabel runnerLabel,
                           boolean plannedChanges,
                           int order,
                           boolean skipWhenDestroying) {
    public OrderedStack {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(runnerLabel, "runnerLabel");
        if (order < 1) throw new IllegalArgumentException("order is 1-based, got " + order);
    }

    static OrderedStack of(StackNode node, int order) {
        StackConfig c = node.config();
        return new OrderedStack(node.id(), c.runnerLabel(), c.plannedChanges(), order, c.skipWhenDestroying());
    }
}

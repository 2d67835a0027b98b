package com.hcltech.stackorder.dag;

import java.util.Objects;

/**
 * Per-stack execution metadata, already validated and defaulted by the loader.
 *
 * @param runnerLabel        runner the stack's job runs on, defaults to {@link RunnerLabel#DEFAULT}
 * @param plannedChanges     whether a plan for the stack is expected to show changes, defaults to {@code true}
 * @param skipWhenDestroying whether a destroy pass should leave the stack alone, defaults to {@code false}
 */
public record StackConfig(RunnerLabel runnerLabel, boolean plannedChanges, boolean skipWhenDestroying) {

    public static final StackConfig DEFAULTS = new StackConfig(RunnerLabel.DEFAULT, true, false);

    public StackConfig {
        Objects.requireNonNull(runnerLabel, "runnerLabel");
    }
}

package com.hcltech.stackorder.config.loader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcltech.stackorder.dag.RunnerLabel;

import java.util.List;

/**
 * The raw shape of a {@code dependencies.json}. Absent optional fields are filled with their defaults.
 * The runner label stays a string here; it is checked against {@link RunnerLabel} by the loader.
 */
public record DependenciesFile(
        @JsonProperty("dependencies") Dependencies dependencies,
        @JsonProperty("runner-label") String runnerLabel,
        @JsonProperty("planned-changes") Boolean plannedChanges,
        @JsonProperty("skip_when_destroying") Boolean skipWhenDestroying
) {
    public DependenciesFile {
        dependencies = dependencies == null ? new Dependencies(List.of()) : dependencies;
        runnerLabel = runnerLabel == null ? RunnerLabel.DEFAULT.label() : runnerLabel;
        plannedChanges = plannedChanges == null ? Boolean.TRUE : plannedChanges;
        skipWhenDestroying = skipWhenDestroying == null ? Boolean.FALSE : skipWhenDestroying;
    }

    public record Dependencies(@JsonProperty("paths") List<String> paths) {
        public Dependencies {
            paths = paths == null ? List.of() : List.copyOf(paths);
        }
    }
}

package com.hcltech.stackorder.dag;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** The CI runner a stack's job is scheduled on. Closed set. */
public enum RunnerLabel {
    UBUNTU_LATEST("ubuntu-latest"),
    SELF_HOSTED("self-hosted");

    public static final RunnerLabel DEFAULT = UBUNTU_LATEST;

    private final String label;

    RunnerLabel(String label) {
        this.label = label;
    }

    /** The label exactly as written in {@code dependencies.json} and in the rendered output. */
    public String label() {
        return label;
    }

    public static Optional<RunnerLabel> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (RunnerLabel r : values()) {
            if (r.label.equals(label)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(RunnerLabel::label).toList();
    }

    @Override
    public String toString() {
        return label;
    }
}

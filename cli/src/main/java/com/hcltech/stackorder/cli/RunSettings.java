package com.hcltech.stackorder.cli;

import com.hcltech.stackorder.dag.SortOrder;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param dotFile where the DOT rendering goes; {@code null} disables drawing
 */
public record RunSettings(Path baseDirectory, int maxDepth, SortOrder sortOrder, Path dotFile) {
    public RunSettings {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        Objects.requireNonNull(sortOrder, "sortOrder");
    }

    public boolean draw() {
        return dotFile != null;
    }
}

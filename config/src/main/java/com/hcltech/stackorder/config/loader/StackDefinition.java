package com.hcltech.stackorder.config.loader;

import com.hcltech.stackorder.dag.StackConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A validated {@code dependencies.json}, ready for {@link com.hcltech.stackorder.dag.StackGraph#insert}.
 *
 * @param stackId      normalized identifier of the stack directory holding the file
 * @param dependencies dependency identifiers as declared
 * @param source       the file the definition came from
 */
public record StackDefinition(String stackId, List<String> dependencies, StackConfig config, Path source) {
    public StackDefinition {
        Objects.requireNonNull(stackId, "stackId");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(source, "source");
        dependencies = List.copyOf(dependencies);
    }
}

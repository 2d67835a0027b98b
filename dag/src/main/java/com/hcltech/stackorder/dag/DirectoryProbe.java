package com.hcltech.stackorder.dag;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Answers whether a stack has a directory under the base directory. Asked once per node, at creation.
 */
@FunctionalInterface
public interface DirectoryProbe {

    boolean hasDirectory(Path baseDirectory, String stackId);

    static DirectoryProbe filesystem() {
        return (base, id) -> Files.isDirectory(base.resolve(StackIds.relativePath(id)));
    }
}

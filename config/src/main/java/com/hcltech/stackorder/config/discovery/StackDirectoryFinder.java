package com.hcltech.stackorder.config.discovery;

import com.hcltech.stackorder.common.errorsor.ErrorsOr;
import com.hcltech.stackorder.dag.StackIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Finds stack directories: those holding a {@code dependencies.json} one to {@code maxDepth} levels
 * below the base directory. Directories without the file are not stacks unless somebody depends on them.
 */
public final class StackDirectoryFinder {
    private static final Logger log = LoggerFactory.getLogger(StackDirectoryFinder.class);

    public static final String FILE_NAME = "dependencies.json";
    public static final int DEFAULT_MAX_DEPTH = 2;

    private StackDirectoryFinder() {}

    /**
     * @return the files, sorted by their path relative to {@code baseDirectory} so that the
     * resulting graph does not depend on filesystem iteration order
     */
    public static ErrorsOr<List<Path>> find(Path baseDirectory, int maxDepth) {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        if (maxDepth < 1) {
            return ErrorsOr.error("maxDepth must be at least 1, got " + maxDepth);
        }
        if (!Files.isDirectory(baseDirectory)) {
            return ErrorsOr.error("Base directory does not exist: " + baseDirectory);
        }
        // the file sits one level below its stack directory
        int walkDepth = maxDepth == Integer.MAX_VALUE ? maxDepth : maxDepth + 1;
        return ErrorsOr.trying(() -> {
            try (Stream<Path> walk = Files.walk(baseDirectory, walkDepth)) {
                List<Path> found = walk
                        .filter(p -> p.getFileName() != null && p.getFileName().toString().equals(FILE_NAME))
                        .filter(Files::isRegularFile)
                        .filter(p -> !baseDirectory.equals(p.getParent()))
                        .sorted(Comparator.comparing(p -> unixRelative(baseDirectory, p)))
                        .toList();
                log.debug("Found {} {} files under {}", found.size(), FILE_NAME, baseDirectory);
                return found;
            }
        }, e -> "Failed to scan " + baseDirectory + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    /** {@code ./a/b} for {@code <base>/a/b/dependencies.json}. */
    public static String stackIdOf(Path baseDirectory, Path file) {
        return StackIds.normalize(unixRelative(baseDirectory, file.getParent()));
    }

    /** {@code ./a/b/dependencies.json}, used to name the file in error messages. */
    public static String displayName(Path baseDirectory, Path file) {
        return StackIds.PREFIX + unixRelative(baseDirectory, file);
    }

    private static String unixRelative(Path baseDirectory, Path p) {
        return baseDirectory.relativize(p).toString().replace('\\', '/');
    }
}

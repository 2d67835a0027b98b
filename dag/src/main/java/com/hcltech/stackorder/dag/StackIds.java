package com.hcltech.stackorder.dag;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack identifiers are relative directory paths written as {@code ./a/b}.
 * <p>
 * {@code stack1}, {@code ./stack1}, {@code ./stack1/} and {@code x/../stack1} all normalize to
 * {@code ./stack1}. Identifiers that are blank, absolute, name the base directory itself or climb
 * out of it are rejected.
 */
public interface StackIds {

    String PREFIX = "./";

    static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Stack identifier must not be blank");
        }
        String unified = raw.trim().replace('\\', '/');
        if (unified.startsWith("/") || unified.matches("^[A-Za-z]:/.*")) {
            throw new IllegalArgumentException("Stack identifier must be relative to the base directory: " + raw);
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    throw new IllegalArgumentException("Stack identifier escapes the base directory: " + raw);
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Stack identifier names the base directory itself: " + raw);
        }
        return PREFIX + String.join("/", segments);
    }

    /** The identifier without its {@code ./} prefix, suitable for {@link java.nio.file.Path#resolve(String)}. */
    static String relativePath(String normalizedId) {
        return normalizedId.startsWith(PREFIX) ? normalizedId.substring(PREFIX.length()) : normalizedId;
    }
}

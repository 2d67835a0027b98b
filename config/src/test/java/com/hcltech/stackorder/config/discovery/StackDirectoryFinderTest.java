package com.hcltech.stackorder.config.discovery;

import com.hcltech.stackorder.config.fixture.StackTreeFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StackDirectoryFinderTest {

    @TempDir
    Path base;

    private StackTreeFixture tree;

    @BeforeEach
    void setUp() {
        tree = new StackTreeFixture(base);
    }

    private List<String> found(int maxDepth) {
        return StackDirectoryFinder.find(base, maxDepth).valueOrThrow().stream()
                .map(p -> StackDirectoryFinder.stackIdOf(base, p))
                .toList();
    }

    @Test
    void noFilesMeansNoStacks() {
        assertEquals(List.of(), found(2));
    }

    @Test
    void findsStacksUpToMaxDepthSortedByPath() {
        tree.stack("stack2", List.of());
        tree.stack("env/prod", List.of());
        tree.stack("stack1", List.of());
        tree.stack("env/prod/too/deep", List.of());

        assertEquals(List.of("./env/prod", "./stack1", "./stack2"), found(2));
        assertEquals(List.of("./env/prod", "./env/prod/too/deep", "./stack1", "./stack2"), found(4));
        assertEquals(List.of("./stack1", "./stack2"), found(1));
    }

    @Test
    void largestDepthMeansUnlimited() {
        tree.stack("a/b/c/d/e", List.of());
        tree.stack("top", List.of());

        assertEquals(List.of("./a/b/c/d/e", "./top"), found(Integer.MAX_VALUE));
    }

    @Test
    void directoriesWithoutTheFileAreIgnored() throws Exception {
        tree.stack("stack1", List.of());
        Path standalone = tree.dir("stack99");
        Files.writeString(standalone.resolve("main.tf"), "");

        assertEquals(List.of("./stack1"), found(2));
    }

    @Test
    void fileAtTheBaseItselfIsIgnored() throws Exception {
        Files.writeString(base.resolve("dependencies.json"), "{}");
        tree.stack("stack1", List.of());

        assertEquals(List.of("./stack1"), found(2));
    }

    @Test
    void aDirectoryNamedLikeTheFileIsIgnored() {
        tree.dir("stack1/dependencies.json");
        assertEquals(List.of(), found(2));
    }

    @Test
    void badArgumentsAreErrors() {
        assertTrue(StackDirectoryFinder.find(base, 0).isError());
        assertTrue(StackDirectoryFinder.find(base.resolve("missing"), 2).errorsOrThrow().get(0).contains("does not exist"));
    }

    @Test
    void namesAreRelativeToTheBase() {
        Path file = tree.stack("env/prod", List.of());
        assertEquals("./env/prod", StackDirectoryFinder.stackIdOf(base, file));
        assertEquals("./env/prod/dependencies.json", StackDirectoryFinder.displayName(base, file));
    }
}

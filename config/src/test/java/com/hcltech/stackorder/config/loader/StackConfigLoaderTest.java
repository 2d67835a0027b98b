package com.hcltech.stackorder.config.loader;

import com.hcltech.stackorder.common.errorsor.ErrorsOr;
import com.hcltech.stackorder.config.fixture.StackTreeFixture;
import com.hcltech.stackorder.dag.RunnerLabel;
import com.hcltech.stackorder.dag.StackConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StackConfigLoaderTest {

    @TempDir
    Path base;

    private StackTreeFixture tree;
    private final StackConfigLoader loader = new StackConfigLoader();

    @BeforeEach
    void setUp() {
        tree = new StackTreeFixture(base);
    }

    private static String joined(ErrorsOr<?> eo) {
        return String.join("\n", eo.errorsOrThrow());
    }

    @Nested
    class ValidFiles {
        @Test
        void minimalFileGetsDefaults() {
            Path file = tree.stack("stack1", List.of("./stack3"));

            StackDefinition def = loader.load(base, file).valueOrThrow();

            assertEquals("./stack1", def.stackId());
            assertEquals(List.of("./stack3"), def.dependencies());
            assertEquals(StackConfig.DEFAULTS, def.config());
            assertEquals(file, def.source());
        }

        @Test
        void allFieldsAreRead() {
            Path file = tree.stack("env/prod", List.of(),
                    "\"runner-label\": \"self-hosted\"",
                    "\"planned-changes\": false",
                    "\"skip_when_destroying\": true");

            StackDefinition def = loader.load(base, file).valueOrThrow();

            assertEquals("./env/prod", def.stackId());
            assertEquals(new StackConfig(RunnerLabel.SELF_HOSTED, false, true), def.config());
        }

        @Test
        void extraMembersCommentsAndTrailingCommasAreTolerated() {
            Path file = tree.raw("stack1", """
                    {
                      // owned by the network team
                      "dependencies": {"paths": ["./vpc",]},
                      "owner": "network",
                    }
                    """);

            assertEquals(List.of("./vpc"), loader.load(base, file).valueOrThrow().dependencies());
        }
    }

    @Nested
    class SchemaViolations {
        @Test
        void fileWithoutDependenciesFailsNamingTheFile() {
            Path file = tree.raw("stack1", "{\"foo\": {\"bar\": \"hello\"}}");

            String msg = joined(loader.load(base, file));

            assertTrue(msg.contains("./stack1/dependencies.json failed to validate against the JSON schema"), msg);
        }

        @Test
        void dependenciesWithoutPathsFails() {
            Path file = tree.raw("stack1", "{\"dependencies\": {}}");
            assertTrue(joined(loader.load(base, file)).contains("failed to validate against the JSON schema"));
        }

        @Test
        void wrongTypesFail() {
            Path file = tree.raw("stack1", "{\"dependencies\": {\"paths\": \"./stack2\"}, \"planned-changes\": \"yes\"}");

            List<String> errors = loader.load(base, file).errorsOrThrow();

            assertEquals(2, errors.size(), errors.toString());
            errors.forEach(e -> assertTrue(e.startsWith("./stack1/dependencies.json failed to validate"), e));
        }

        @Test
        void nonStringPathEntriesFail() {
            Path file = tree.raw("stack1", "{\"dependencies\": {\"paths\": [1, true]}}");
            assertTrue(loader.load(base, file).isError());
        }

        @Test
        void jsonStringDocumentFails() {
            Path file = tree.raw("stack1", "\"hellohellohellohello\"");

            String msg = joined(loader.load(base, file));

            assertTrue(msg.contains("failed to validate against the JSON schema"), msg);
            assertTrue(msg.contains("stack1"), msg);
            assertTrue(msg.contains("dependencies.json"), msg);
        }

        @Test
        void malformedJsonFails() {
            Path file = tree.raw("stack1", "helloworld");

            String msg = joined(loader.load(base, file));

            assertTrue(msg.startsWith("./stack1/dependencies.json failed to validate against the JSON schema: malformed JSON"), msg);
        }

        @Test
        void emptyFileFails() {
            Path file = tree.raw("stack1", "");
            assertTrue(joined(loader.load(base, file)).contains("failed to validate against the JSON schema"));
        }
    }

    @Nested
    class RunnerLabels {
        @Test
        void labelOutsideTheClosedSetIsAnInvalidEnumerationError() {
            Path file = tree.stack("stack1", List.of(), "\"runner-label\": \"windows-latest\"");

            List<String> errors = loader.load(base, file).errorsOrThrow();

            assertEquals(List.of("./stack1/dependencies.json: invalid runner-label 'windows-latest' (expected one of [ubuntu-latest, self-hosted])"), errors);
        }

        @Test
        void labelsAreCaseSensitive() {
            Path file = tree.stack("stack1", List.of(), "\"runner-label\": \"Ubuntu-Latest\"");
            assertTrue(joined(loader.load(base, file)).contains("invalid runner-label 'Ubuntu-Latest'"));
        }
    }

    @Nested
    class DependencyPaths {
        @Test
        void pathOutsideTheBaseDirectoryNamesTheFile() {
            Path file = tree.stack("app", List.of("./db", "../shared"));

            List<String> errors = loader.load(base, file).errorsOrThrow();

            assertEquals(List.of("./app/dependencies.json: invalid dependency path '../shared': "
                    + "Stack identifier escapes the base directory: ../shared"), errors);
        }

        @Test
        void everyBadPathIsReported() {
            Path file = tree.stack("app", List.of(".", "/etc", " "));

            List<String> errors = loader.load(base, file).errorsOrThrow();

            assertEquals(3, errors.size(), errors.toString());
            errors.forEach(e -> assertTrue(e.startsWith("./app/dependencies.json: invalid dependency path"), e));
        }

        @Test
        void badPathAndBadLabelAreBothReported() {
            Path file = tree.stack("app", List.of("../x"), "\"runner-label\": \"macos\"");

            List<String> errors = loader.load(base, file).errorsOrThrow();

            assertEquals(2, errors.size(), errors.toString());
            assertTrue(errors.get(0).contains("invalid runner-label 'macos'"), errors.get(0));
            assertTrue(errors.get(1).contains("invalid dependency path '../x'"), errors.get(1));
        }

        @Test
        void pathsThatStayInsideTheBaseAreAccepted() {
            Path file = tree.stack("env/prod", List.of("env/../network", "./iam/"));

            assertEquals(List.of("env/../network", "./iam/"), loader.load(base, file).valueOrThrow().dependencies());
        }
    }

    @Nested
    class LoadAll {
        @Test
        void collectsErrorsFromEveryFile() {
            Path good = tree.stack("good", List.of());
            Path badSchema = tree.raw("bad1", "{}");
            Path badLabel = tree.stack("bad2", List.of(), "\"runner-label\": \"macos\"");

            List<String> errors = loader.loadAll(base, List.of(good, badSchema, badLabel)).errorsOrThrow();

            assertEquals(2, errors.size(), errors.toString());
            assertTrue(errors.get(0).startsWith("./bad1/dependencies.json"), errors.get(0));
            assertTrue(errors.get(1).startsWith("./bad2/dependencies.json"), errors.get(1));
        }

        @Test
        void keepsFileOrderOnSuccess() {
            Path b = tree.stack("b", List.of());
            Path a = tree.stack("a", List.of("./b"));

            List<StackDefinition> defs = loader.loadAll(base, List.of(b, a)).valueOrThrow();

            assertEquals(List.of("./b", "./a"), defs.stream().map(StackDefinition::stackId).toList());
        }
    }

    @Test
    void missingFileIsReportedAsUnreadable() {
        Path file = base.resolve("ghost").resolve("dependencies.json");
        String msg = joined(loader.load(base, file));
        assertTrue(msg.startsWith("./ghost/dependencies.json could not be read"), msg);
    }

    @Test
    void missingSchemaResourceFailsFast() {
        assertThrows(IllegalStateException.class, () -> StackConfigLoader.loadSchema("/no-such-schema.json"));
    }
}

package com.hcltech.stackorder.config.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.hcltech.stackorder.common.errorsor.ErrorsOr;
import com.hcltech.stackorder.config.discovery.StackDirectoryFinder;
import com.hcltech.stackorder.dag.RunnerLabel;
import com.hcltech.stackorder.dag.StackConfig;
import com.hcltech.stackorder.dag.StackIds;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code dependencies.json} files: JSON parse, schema check, runner-label and dependency-path
 * checks, defaults.
 * <p>
 * Every problem is reported as an error string starting with the file's path relative to the base
 * directory (for example {@code ./stack1/dependencies.json}).
 */
public final class StackConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(StackConfigLoader.class);

    public static final String SCHEMA_RESOURCE = "/dependencies.schema.json";

    private static final ObjectMapper JSON = BaseConfigLoader.base();
    private static final ObjectReader FILE_READER = JSON.readerFor(DependenciesFile.class);

    private final JsonSchema schema;

    public StackConfigLoader() {
        this(loadSchema(SCHEMA_RESOURCE));
    }

    StackConfigLoader(JsonSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /** Loads every file, collecting the errors of all of them. */
    public ErrorsOr<List<StackDefinition>> loadAll(Path baseDirectory, List<Path> files) {
        List<ErrorsOr<StackDefinition>> loaded = new ArrayList<>(files.size());
        for (Path file : files) loaded.add(load(baseDirectory, file));
        return ErrorsOr.sequence(loaded);
    }

    public ErrorsOr<StackDefinition> load(Path baseDirectory, Path file) {
        String displayName = StackDirectoryFinder.displayName(baseDirectory, file);
        String stackId = StackDirectoryFinder.stackIdOf(baseDirectory, file);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return ErrorsOr.error(displayName + " could not be read: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return fromJson(json, displayName)
                .map(raw -> new StackDefinition(stackId, raw.dependencies().paths(), toConfig(raw), file));
    }

    /**
     * Parses and validates one document.
     *
     * @param displayName used as prefix for every error
     */
    public ErrorsOr<DependenciesFile> fromJson(String json, String displayName) {
        JsonNode tree;
        try {
            tree = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            return schemaError(displayName, "malformed JSON: " + e.getOriginalMessage());
        }
        if (tree == null || tree.isMissingNode()) {
            return schemaError(displayName, "document is empty");
        }

        List<String> violations = schema.validate(tree).stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
        if (!violations.isEmpty()) {
            log.debug("{} violates the schema: {}", displayName, violations);
            return ErrorsOr.errors(violations.stream()
                    .map(v -> displayName + " failed to validate against the JSON schema: " + v)
                    .toList());
        }

        DependenciesFile raw;
        try {
            raw = FILE_READER.readValue(tree);
        } catch (IOException e) {
            return schemaError(displayName, e.getMessage());
        }
        List<String> problems = new ArrayList<>();
        if (RunnerLabel.fromLabel(raw.runnerLabel()).isEmpty()) {
            problems.add(displayName + ": invalid runner-label '" + raw.runnerLabel()
                    + "' (expected one of " + RunnerLabel.labels() + ")");
        }
        for (String path : raw.dependencies().paths()) {
            invalidPath(path).ifPresent(why -> problems.add(displayName + ": invalid dependency path '" + path + "': " + why));
        }
        return problems.isEmpty() ? ErrorsOr.lift(raw) : ErrorsOr.errors(problems);
    }

    /** Blank, absolute and base-escaping paths cannot name a stack below the base directory. */
    private static Optional<String> invalidPath(String path) {
        try {
            StackIds.normalize(path);
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
    }

    static StackConfig toConfig(DependenciesFile raw) {
        RunnerLabel label = RunnerLabel.fromLabel(raw.runnerLabel())
                .orElseThrow(() -> new IllegalArgumentException("Unvalidated runner-label: " + raw.runnerLabel()));
        return new StackConfig(label, raw.plannedChanges(), raw.skipWhenDestroying());
    }

    private static <T> ErrorsOr<T> schemaError(String displayName, String complaint) {
        return ErrorsOr.error(displayName + " failed to validate against the JSON schema: " + complaint);
    }

    static JsonSchema loadSchema(String resource) {
        try (InputStream in = StackConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Classpath resource not found: " + resource);
            }
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema " + resource, e);
        }
    }
}

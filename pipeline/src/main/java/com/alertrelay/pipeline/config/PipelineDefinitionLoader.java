package com.alertrelay.pipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link PipelineDefinition}s from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_PIPELINE_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*}/{@code from*} method runs
 * {@link PipelineDefinition#validate()} after parsing and fails fast on a
 * structurally invalid definition.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineDefinitionLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineDefinitionLoader.class);

    /** Environment variable that can override the default definition location. */
    public static final String ENV_PIPELINE_PATH = "RELAY_PIPELINE_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private PipelineDefinitionLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the definition from {@value #ENV_PIPELINE_PATH} when it names an
     * existing file, otherwise from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated definition
     * @throws IllegalStateException if validation fails
     */
    public static PipelineDefinition load() {
        String envPath = System.getenv(ENV_PIPELINE_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading pipeline definition from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading pipeline definition from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineDefinition fromFile(String path) {
        Objects.requireNonNull(path, "Pipeline definition path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Pipeline definition file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pipeline definition file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineDefinition fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PipelineDefinitionLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse an inline YAML document.
     *
     * @throws IllegalStateException if parsing or validation fails
     */
    public static PipelineDefinition fromString(String yamlText) {
        Objects.requireNonNull(yamlText, "YAML text must not be null");
        return parseAndValidate(new StringReader(yamlText), "inline document");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static PipelineDefinition parseAndValidate(InputStream is, String origin) {
        return parseAndValidate(new InputStreamReader(is, StandardCharsets.UTF_8), origin);
    }

    private static PipelineDefinition parseAndValidate(Reader reader, String origin) {
        try {
            return parse(newYaml().load(reader), origin);
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid pipeline YAML in " + origin + ": " + e.getMessage(), e);
        }
    }

    private static PipelineDefinition parse(PipelineDefinition definition, String origin) {
        if (definition == null) {
            throw new IllegalStateException("Pipeline definition is empty: " + origin);
        }
        definition.validate();
        LOG.info("Loaded pipeline '{}' v{} with {} node(s) from {}",
                definition.getName(), definition.getVersion(), definition.getNodes().size(), origin);
        return definition;
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(PipelineDefinition.class, options));
    }
}

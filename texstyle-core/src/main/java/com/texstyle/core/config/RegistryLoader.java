package com.texstyle.core.config;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a {@link StyleRegistry} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_REGISTRY_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method validates through {@link StyleRegistry#of(RegistryConfig)}, so
 * a malformed registry fails at startup rather than during resolution.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryLoader.class);

    /** Environment variable that can override the default registry location. */
    public static final String ENV_REGISTRY_PATH = "TEXSTYLE_REGISTRY_PATH";

    /** Registry bundled with the library. */
    public static final String DEFAULT_RESOURCE = "texstyle-registry.yml";

    private RegistryLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the registry using automatic resolution.
     *
     * @return parsed and validated registry
     * @throws IllegalStateException if validation fails
     */
    public static StyleRegistry load() {
        String envPath = System.getenv(ENV_REGISTRY_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading style registry from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading style registry from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the registry from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated registry
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static StyleRegistry fromFile(String path) {
        Objects.requireNonNull(path, "Registry file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Registry file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read registry file: " + path, e);
        }
    }

    /**
     * Load the registry from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated registry
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static StyleRegistry fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RegistryLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static StyleRegistry parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RegistryConfig.class, options));
        RegistryConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed registry YAML: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Style registry source is empty");
            config = new RegistryConfig();
        }
        StyleRegistry registry = StyleRegistry.of(config);
        LOG.info("Loaded {} fragment(s) and {} renderer option(s)",
                registry.fragmentNames().size(), registry.rendererOptions().size());
        return registry;
    }
}

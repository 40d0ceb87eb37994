package com.fdrsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates {@link DetectionConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * <li>{@link DetectionConfig#fromEnvironment()} when no file is found</li>
 * </ol>
 * <p>
 * A file only overrides the keys it sets; every other property comes from
 * the {@code FDR_*} environment variables, then the built-in defaults.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link DetectionSettings#validate()} after
 * parsing so that a misconfigured run <strong>fails fast</strong> before any
 * data is read.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConfigLoader.class);

    /** Environment variable that can point at a detection YAML file. */
    public static final String ENV_CONFIG_PATH = "FDR_CONFIG_PATH";

    /** Classpath resource consulted when no explicit file is configured. */
    public static final String DEFAULT_RESOURCE = "fdr-detection.yml";

    private DetectionConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectionConfig load() {
        return load(System.getenv());
    }

    /**
     * Load configuration using automatic resolution against the given
     * variable map instead of the process environment.
     *
     * @param environment variable name to value; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectionConfig load(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        DetectionConfig base = DetectionConfig.fromEnvironment(environment);
        String envPath = environment.get(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detection config from environment path: {}", envPath);
            return fromFile(envPath, base);
        }
        if (DetectionConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading detection config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE, base);
        }
        LOG.info("No detection config file found, using environment defaults");
        return base;
    }

    /**
     * Load configuration from a file system path, on top of
     * {@link DetectionConfig#fromEnvironment()}.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionConfig fromFile(String path) {
        return fromFile(path, DetectionConfig.fromEnvironment());
    }

    /**
     * Load configuration from a file system path, on top of {@code base}.
     *
     * @param path YAML file path; must not be {@code null}
     * @param base values for the keys the file leaves out
     * @return parsed and validated configuration
     */
    public static DetectionConfig fromFile(String path, DetectionConfig base) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, base);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detection config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detection config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource, on top of
     * {@link DetectionConfig#fromEnvironment()}.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionConfig fromClasspath(String resource) {
        return fromClasspath(resource, DetectionConfig.fromEnvironment());
    }

    /**
     * Load configuration from a classpath resource, on top of {@code base}.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @param base     values for the keys the resource leaves out
     * @return parsed and validated configuration
     */
    public static DetectionConfig fromClasspath(String resource, DetectionConfig base) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, base);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DetectionConfig parseAndValidate(InputStream is, DetectionConfig base) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionSettings.class, options));
        DetectionSettings settings = yaml.load(is);

        if (settings == null) {
            LOG.warn("Detection config is empty, using defaults");
            settings = new DetectionSettings();
        }
        settings.validate();

        DetectionConfig config = settings.toConfig(base);
        LOG.info("Loaded {}", config);
        return config;
    }
}

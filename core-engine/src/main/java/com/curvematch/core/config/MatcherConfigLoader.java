package com.curvematch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Resolves, parses and validates a {@link MatcherConfig}.
 *
 * <h3>Resolution</h3>
 * <p>
 * {@link #resolve(String)} takes the first source that is set:
 * </p>
 * <ol>
 * <li>the explicit path handed in by the caller</li>
 * <li>the file named by {@value #ENV_CONFIG_PATH}</li>
 * <li>{@value #DEFAULT_RESOURCE} on the classpath</li>
 * </ol>
 * <p>
 * A path that is set but names no file is an error; it never silently falls
 * through to the next source. An empty document yields
 * {@link MatcherConfig#defaults()}. Every result is validated.
 * </p>
 *
 * @since 1.0.0
 */
public final class MatcherConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MatcherConfigLoader.class);

    /** Environment variable naming a config file. */
    public static final String ENV_CONFIG_PATH = "MATCHER_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "matcher.yml";

    private MatcherConfigLoader() {
    }

    /**
     * Resolve from the environment or the classpath.
     *
     * @return validated configuration
     */
    public static MatcherConfig load() {
        return resolve(null);
    }

    /**
     * Resolve with an optional caller-supplied path taking precedence.
     *
     * @param explicitPath config file path; {@code null} or blank to fall back
     *                     to the environment and then the classpath
     * @return validated configuration
     * @throws IllegalArgumentException if a configured file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MatcherConfig resolve(String explicitPath) {
        return resolve(explicitPath, System::getenv);
    }

    static MatcherConfig resolve(String explicitPath, UnaryOperator<String> environment) {
        if (isSet(explicitPath)) {
            return fromFile(explicitPath);
        }
        String envPath = environment.apply(ENV_CONFIG_PATH);
        if (isSet(envPath)) {
            LOG.info("Using matcher config from {}={}", ENV_CONFIG_PATH, envPath);
            return fromFile(envPath);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MatcherConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Matcher config file not found: " + file.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read matcher config file: " + file, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MatcherConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = MatcherConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static MatcherConfig parse(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        MatcherConfig parsed = new Yaml(new Constructor(MatcherConfig.class, options)).load(reader);

        MatcherConfig config = parsed != null ? parsed : MatcherConfig.defaults();
        if (parsed == null) {
            LOG.warn("{} is empty, using default matcher settings", origin);
        }
        config.validate();
        LOG.info("Loaded {} from {}", config, origin);
        return config;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}

package com.providersentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads and validates {@link SignalRulesConfig} from a YAML source.
 *
 * <p>
 * The caller decides where the rules come from: {@link #load(Optional)}
 * reads the given file when one is configured and falls back to the bundled
 * {@value #DEFAULT_RESOURCE} otherwise.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link SignalRulesConfig#validate()} after
 * parsing, so a misconfigured threshold stops the run before any dataset is
 * read.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalRulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SignalRulesLoader.class);

    /** Classpath resource shipped with the engine. */
    public static final String DEFAULT_RESOURCE = "signals.yml";

    private SignalRulesLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules from {@code path} when present, otherwise from the bundled
     * {@value #DEFAULT_RESOURCE}.
     *
     * @param path optional external rules file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file or resource does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static SignalRulesConfig load(Optional<Path> path) {
        Objects.requireNonNull(path, "Signal rules path must not be null");
        if (path.isPresent()) {
            LOG.info("Loading signal rules from file: {}", path.get());
            return fromFile(path.get().toString());
        }
        LOG.info("Loading signal rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated rules configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static SignalRulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Signal rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Signal rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read signal rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static SignalRulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SignalRulesLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static SignalRulesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SignalRulesConfig.class, options));
        SignalRulesConfig config = yaml.load(is);

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No signal rules defined in configuration");
            config = new SignalRulesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} signal rule(s), {} enabled",
                config.getRules().size(), config.getEnabledRules().size());
        return config;
    }
}

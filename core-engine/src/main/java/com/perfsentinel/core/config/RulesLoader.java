package com.perfsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link RulesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so an invalid rule file
 * fails at startup with a {@link ConfigurationException} listing every error.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
    }

    /**
     * Load rules from {@code RULES_CONFIG_PATH} when it names an existing file,
     * otherwise from {@code rules.yml} on the classpath.
     */
    public static RulesConfig load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading rules from environment path: {}", envPath);
            return fromFile(Path.of(envPath));
        }
        LOG.info("Loading rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read
     * @throws ConfigurationException   if parsing or validation fails
     */
    public static RulesConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return parseAndValidate(is, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigurationException   if parsing or validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static RulesConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));

        RulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed rules configuration " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Rules configuration {} is empty", source);
            config = new RulesConfig();
        }
        config.validate();

        LOG.info("Loaded {} alert rule(s) and {} scaling rule(s) from {}",
                config.getAlertRules().size(), config.getScalingRules().size(), source);
        return config;
    }
}

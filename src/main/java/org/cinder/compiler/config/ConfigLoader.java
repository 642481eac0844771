package org.cinder.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Responsible for loading the compiler configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "cinder.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code cinder.conf} in the working directory as the file layer.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     * @see #load(Path)
     */
    public static Config load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables ({@code CONFIG_FORCE_cinder_compiler_verbosity=3})
     * 2. Java System Properties ({@code -Dcinder.compiler.verbosity=3})
     * 3. Configuration File
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configPath The configuration file; skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final Path configPath) {
        // 1. Environment overrides (highest precedence).
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();

        // 2. -Dkey=value system properties.
        final Config propertiesConfig = ConfigFactory.systemProperties();

        // 3. Configuration file from the filesystem.
        final File configFile = configPath.toFile();
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        // 4. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}

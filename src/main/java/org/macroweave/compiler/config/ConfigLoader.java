package org.macroweave.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the compiler configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The file looked up when no explicit configuration file is named. */
    public static final String DEFAULT_CONFIG_FILE_NAME = "macroweave.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration from {@value #DEFAULT_CONFIG_FILE_NAME} in the working directory.
     *
     * @return A resolved {@link Config}.
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dmacro.compile-time.debug-warnings=true)
     * 2. Configuration file (from the filesystem, or else from the classpath)
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configFileName The configuration file to read.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configFileName) {
        final Config cliConfig = ConfigFactory.systemProperties();

        final File configFile = new File(configFileName);
        Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(configFileName);
            if (fileConfig.isEmpty()) {
                LOG.info("Configuration file '{}' not found or is empty. Using defaults.", configFileName);
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        return cliConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}

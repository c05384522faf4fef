package org.jackc.config;

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

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "jackc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties, e.g. {@code -Djackc.output.indent=true}
     * 3. Configuration File: the explicit file if given, otherwise {@code jackc.conf} in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file named on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if the explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        return load(explicitFile, new File(CONFIG_FILE_NAME));
    }

    /**
     * Variant of {@link #load(File)} with a configurable fallback file, used by tests.
     *
     * @param explicitFile A file named on the command line, or {@code null}.
     * @param workingDirectoryFile The file used when no explicit file is given.
     * @return The resolved configuration.
     */
    static Config load(final File explicitFile, final File workingDirectoryFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysPropsConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else if (workingDirectoryFile.isFile()) {
            LOG.info("Loading configuration from file: {}", workingDirectoryFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(workingDirectoryFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", workingDirectoryFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(sysPropsConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}

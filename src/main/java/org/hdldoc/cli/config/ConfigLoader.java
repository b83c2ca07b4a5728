package org.hdldoc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "hdldoc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with the working directory of the process.
     * @param explicitFile The file given with {@code --config}, or {@code null}.
     * @return The resolved configuration.
     * @see #load(File, File)
     */
    public static Config load(final File explicitFile) {
        return load(explicitFile, new File(System.getProperty("user.dir")));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. The file given with --config, or else hdldoc.conf in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile The file given with {@code --config}, or {@code null}.
     * @param workingDirectory The directory searched for {@code hdldoc.conf}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if {@code explicitFile} does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed.
     */
    public static Config load(final File explicitFile, final File workingDirectory) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via --config was not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdConfigFile = new File(workingDirectory, CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.info("Using configuration file found in working directory: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("No '{}' in {}, using classpath defaults.", CONFIG_FILE_NAME, workingDirectory);
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(sysConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}

package org.ctiextract.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the library configuration.
 * <p>
 * Layers, from strongest to weakest:
 * <ol>
 *   <li>system properties ({@code -Dcti-extract.windows.parallel-fpr=...})</li>
 *   <li>environment variables</li>
 *   <li>the user file ({@code config/cti-extract.conf} or one given explicitly)</li>
 *   <li>{@code reference.conf} from the classpath</li>
 * </ol>
 * Substitutions are resolved once all layers are stacked, so a user override reaches values in
 * {@code reference.conf} that refer to it.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Root path of every library setting. */
    public static final String ROOT_PATH = "cti-extract";

    private static final String USER_DIR = "config";
    private static final String USER_FILE = "cti-extract.conf";

    private ConfigLoader() {
    }

    /**
     * Picks the user file from, in order: {@code explicitFile}, the {@code config.file} system
     * property, {@code config/cti-extract.conf} in the working directory. Without any of them only
     * the classpath defaults apply.
     *
     * @param explicitFile A config file, or {@code null} for discovery.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitFile) {
        if (explicitFile != null) {
            File file = requireExisting(explicitFile, "Configuration file");
            LOG.info("Loading configuration from {}", file.getAbsolutePath());
            return loadFromFile(file);
        }

        final String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            File file = requireExisting(new File(propertyPath).getAbsoluteFile(), "Configuration file from -Dconfig.file");
            LOG.info("Loading configuration from -Dconfig.file {}", file.getAbsolutePath());
            return loadFromFile(file);
        }

        final File userFile = new File(USER_DIR, USER_FILE);
        if (userFile.isFile()) {
            LOG.info("Loading configuration from working directory {}", userFile.getAbsolutePath());
            return loadFromFile(userFile);
        }

        LOG.info("No {}/{} present, using classpath defaults", USER_DIR, USER_FILE);
        return loadDefaults();
    }

    /**
     * @return The {@code cti-extract} block of the discovered configuration.
     */
    public static Config resolveLibraryConfig() {
        return resolve(null).getConfig(ROOT_PATH);
    }

    static Config loadFromFile(final File file) {
        return layered(ConfigFactory.parseFile(file));
    }

    static Config loadDefaults() {
        return layered(ConfigFactory.empty());
    }

    private static Config layered(Config userLayer) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static File requireExisting(File file, String what) {
        if (!file.exists()) {
            throw new IllegalArgumentException(what + " not found: " + file.getAbsolutePath());
        }
        return file;
    }
}

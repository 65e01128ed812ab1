package org.tessera.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.HashSet;

/**
 * Loads {@link CompilerConfig} from HOCON.
 * <p>
 * Sources are layered with the first one winning: system properties, environment variables,
 * an optional configuration file, then the defaults from {@code reference.conf} on the classpath.
 * All compiler settings live under {@value #ROOT}.
 */
public final class CompilerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerConfigLoader.class);

    /** The configuration path holding all compiler settings. */
    public static final String ROOT = "tessera.compiler";

    private CompilerConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the layered configuration.
     *
     * @param configFile An optional configuration file, may be {@code null}.
     * @return The resolved configuration tree.
     * @throws ConfigException if the file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config loadConfig(File configFile) {
        Config fileConfig = ConfigFactory.empty();
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(configFile.getPath()),
                        "Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        }

        // Config load order: System Props > Env Vars > File > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    /**
     * Loads the layered configuration and converts its compiler section.
     *
     * @param configFile An optional configuration file, may be {@code null}.
     * @return The compiler configuration.
     */
    public static CompilerConfig load(File configFile) {
        return fromConfig(loadConfig(configFile));
    }

    /**
     * Converts a configuration tree into a {@link CompilerConfig}. Missing keys fall back to
     * {@link CompilerConfig#defaults()}.
     *
     * @param config A configuration tree containing {@value #ROOT}, or the compiler section itself.
     * @return The compiler configuration.
     * @throws ConfigException.WrongType if a value has the wrong type.
     */
    public static CompilerConfig fromConfig(Config config) {
        Config section = config.hasPath(ROOT) ? config.getConfig(ROOT) : config;
        CompilerConfig defaults = CompilerConfig.defaults();

        String directivePrefix = getString(section, "directive-prefix", defaults.directivePrefix());
        String elementPrefix = getString(section, "element-prefix", defaults.elementPrefix());
        String fragmentElement = getString(section, "fragment-element", "");
        return new CompilerConfig(
                directivePrefix,
                elementPrefix,
                fragmentElement.isBlank() ? null : fragmentElement,
                getString(section, "slot-attribute", defaults.slotAttribute()),
                getString(section, "bind-attribute", defaults.bindAttribute()),
                section.hasPath("void-tags") ? new HashSet<>(section.getStringList("void-tags")) : defaults.voidTags(),
                section.hasPath("pass-through-comments") ? section.getBoolean("pass-through-comments") : defaults.passThroughComments(),
                section.hasPath("debug") ? section.getBoolean("debug") : defaults.debug(),
                section.hasPath("pipeline.max-depth") ? section.getInt("pipeline.max-depth") : defaults.maxDepth(),
                section.hasPath("pipeline.max-replays") ? section.getInt("pipeline.max-replays") : defaults.maxReplays()
        );
    }

    private static String getString(Config config, String path, String fallback) {
        return config.hasPath(path) ? config.getString(path) : fallback;
    }
}

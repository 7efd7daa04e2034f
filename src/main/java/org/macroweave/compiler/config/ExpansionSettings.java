package org.macroweave.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code macro.expansion} configuration block.
 *
 * <pre>
 * macro {
 *   expansion {
 *     max-depth = 64     # nested expansions allowed per call site, at most 1024
 *     parallelism = 1    # compilation units expanded concurrently
 *   }
 *   compile-time { }     # key-value pairs readable by macros during expansion only
 * }
 * </pre>
 *
 * @param maxDepth The maximum expansion depth.
 * @param parallelism The number of units expanded concurrently.
 * @param compileTimeValues The compile-time configuration surface.
 */
public record ExpansionSettings(int maxDepth, int parallelism, Config compileTimeValues) {

    public static final int DEFAULT_MAX_DEPTH = 64;

    /** Expansion recurses on the call stack; deeper limits could overflow it before the counter trips. */
    public static final int MAX_DEPTH_CEILING = 1024;

    private static final String EXPANSION_PATH = "macro.expansion";
    private static final String COMPILE_TIME_PATH = "macro.compile-time";

    public ExpansionSettings {
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_CEILING) {
            throw new IllegalArgumentException("macro.expansion.max-depth must be between 1 and "
                    + MAX_DEPTH_CEILING + ", was " + maxDepth);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("macro.expansion.parallelism must be at least 1, was " + parallelism);
        }
        compileTimeValues = compileTimeValues == null ? ConfigFactory.empty() : compileTimeValues;
    }

    /**
     * @return Settings with a depth of {@value #DEFAULT_MAX_DEPTH}, sequential expansion and no compile-time values.
     */
    public static ExpansionSettings defaults() {
        return new ExpansionSettings(DEFAULT_MAX_DEPTH, 1, ConfigFactory.empty());
    }

    /**
     * Reads the settings; missing keys take their defaults.
     * @param config The loaded configuration.
     * @return The settings.
     */
    public static ExpansionSettings fromConfig(Config config) {
        Config expansion = config.hasPath(EXPANSION_PATH) ? config.getConfig(EXPANSION_PATH) : ConfigFactory.empty();
        int maxDepth = expansion.hasPath("max-depth") ? expansion.getInt("max-depth") : DEFAULT_MAX_DEPTH;
        int parallelism = expansion.hasPath("parallelism") ? expansion.getInt("parallelism") : 1;
        Config compileTime = config.hasPath(COMPILE_TIME_PATH) ? config.getConfig(COMPILE_TIME_PATH) : ConfigFactory.empty();
        return new ExpansionSettings(maxDepth, parallelism, compileTime);
    }
}

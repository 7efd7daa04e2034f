package org.macroweave.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Applies the {@code logging} block of the compiler configuration to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"    # root logger
 *   levels {
 *     "org.macroweave.compiler.macro.expand" = "TRACE"
 *   }
 * }
 * </pre>
 *
 * Levels are applied once per JVM; later calls are ignored until {@link #reset()}.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final AtomicBoolean CONFIGURED = new AtomicBoolean();

    private LoggingConfigurator() {}

    /**
     * @param config The loaded configuration; a missing {@code logging} block leaves Logback untouched.
     */
    public static void configure(final Config config) {
        if (!CONFIGURED.compareAndSet(false, true) || !config.hasPath("logging")) {
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("default-level")) {
            apply(context, Logger.ROOT_LOGGER_NAME, logging.getString("default-level"));
        }
        if (logging.hasPath("levels")) {
            logging.getConfig("levels").root()
                    .forEach((loggerName, value) -> apply(context, loggerName, String.valueOf(value.unwrapped())));
        }
    }

    private static void apply(final LoggerContext context, final String loggerName, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOG.warn("Ignoring unknown log level '{}' for logger '{}'.", levelName, loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(level);
        LOG.debug("Logger '{}' set to {}", loggerName, level);
    }

    /**
     * Allows the next {@link #configure} call to apply its levels again. For tests.
     */
    public static void reset() {
        CONFIGURED.set(false);
    }
}

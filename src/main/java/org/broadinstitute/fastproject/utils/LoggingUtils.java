package org.broadinstitute.fastproject.utils;

import com.google.common.collect.ImmutableMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import java.util.Map;

/**
 * Applies the tools' {@code --verbosity} argument.
 *
 * The argument is typed as htsjdk's {@link Log.LogLevel} because the parser needs an enum and log4j levels are
 * not one. The chosen level is applied to htsjdk's global logger and to every FastProject log4j logger.
 */
public final class LoggingUtils {

    private static final String ROOT_PACKAGE = "org.broadinstitute.fastproject";

    private static final Map<Log.LogLevel, Level> LOG4J_LEVELS = ImmutableMap.of(
            Log.LogLevel.ERROR, Level.ERROR,
            Log.LogLevel.WARNING, Level.WARN,
            Log.LogLevel.INFO, Level.INFO,
            Log.LogLevel.DEBUG, Level.DEBUG);

    private LoggingUtils() { }

    public static Level toLog4jLevel(final Log.LogLevel level) {
        return LOG4J_LEVELS.get(Utils.nonNull(level));
    }

    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Log.setGlobalLogLevel(Utils.nonNull(verbosity));
        Configurator.setLevel(ROOT_PACKAGE, toLog4jLevel(verbosity));
    }
}

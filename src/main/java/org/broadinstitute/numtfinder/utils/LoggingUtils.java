package org.broadinstitute.numtfinder.utils;

import com.google.common.collect.ImmutableMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;

import java.util.Map;

/**
 * Applies the {@code --verbosity} of a tool to both logging systems in use: log4j for NUMTFinder itself and
 * the htsjdk {@link Log} used by the FASTA readers and writers.
 * <p>
 * The argument is an htsjdk {@link Log.LogLevel} because log4j levels are not an enum the argument parser can
 * bind to.
 * </p>
 */
public final class LoggingUtils {

    private static final Map<Log.LogLevel, Level> LOG4J_LEVELS = ImmutableMap.of(
            Log.LogLevel.ERROR, Level.ERROR,
            Log.LogLevel.WARNING, Level.WARN,
            Log.LogLevel.INFO, Level.INFO,
            Log.LogLevel.DEBUG, Level.DEBUG);

    private LoggingUtils() {}

    public static Level levelToLog4jLevel(final Log.LogLevel verbosity) {
        return LOG4J_LEVELS.get(Utils.nonNull(verbosity, "verbosity"));
    }

    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Log.setGlobalLogLevel(Utils.nonNull(verbosity, "verbosity"));
        final LoggerContext context = (LoggerContext) LogManager.getContext(false);
        context.getConfiguration().getRootLogger().setLevel(levelToLog4jLevel(verbosity));
        context.updateLoggers();
    }
}

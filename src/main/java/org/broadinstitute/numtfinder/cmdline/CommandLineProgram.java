package org.broadinstitute.numtfinder.cmdline;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLinePluginDescriptor;
import org.broadinstitute.barclay.argparser.CommandLinePluginProvider;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.broadinstitute.numtfinder.utils.LoggingUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the NUMTFinder tools.
 * <p>
 * A tool declares its inputs as {@link Argument} and {@link ArgumentCollection} fields, may reject argument
 * combinations in {@link #customCommandLineValidation()} and does its work in {@link #doWork()}. Whatever
 * {@code doWork} returns is handed back to the caller of {@link #instanceMain(String[])} unchanged.
 * </p>
 */
public abstract class CommandLineProgram implements CommandLinePluginProvider {

    // named after the concrete tool
    protected final Logger logger = LogManager.getLogger(getClass());

    private static final String TOOLKIT_NAME = "NUMTFinder";

    @ArgumentCollection(doc = "Arguments handled by the parser itself, such as --help and --version")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME,
            doc = "Logging verbosity",
            common = true,
            optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME,
            doc = "Skip the start and end of run summary",
            common = true,
            optional = true)
    public Boolean QUIET = false;

    private CommandLineParser commandLineParser;

    private String commandLine;

    /**
     * @return the tool result, or {@code null}
     */
    protected abstract Object doWork();

    /**
     * Called once all arguments are parsed.
     *
     * @return {@code null} when the arguments are consistent, otherwise the problems found
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses {@code argv} and runs the tool.
     *
     * @return the result of {@link #doWork()}, or 0 when only help or the version was asked for
     * @throws CommandLineException if the arguments are missing, malformed or inconsistent
     */
    public Object instanceMain(final String[] argv) {
        if (!getCommandLineParser().parseArguments(System.err, argv)) {
            return 0;
        }
        commandLine = getCommandLineParser().getCommandLine();
        final String[] problems = customCommandLineValidation();
        if (problems != null && problems.length > 0) {
            throw new CommandLineException("Invalid arguments: " + String.join("; ", problems));
        }
        return runTool();
    }

    /**
     * Runs {@link #doWork()} at the requested verbosity, logging the run summary unless {@code --QUIET}.
     */
    public final Object runTool() {
        LoggingUtils.setLoggingLevel(VERBOSITY);
        final Instant start = Instant.now();
        if (!QUIET) {
            logger.info(String.format("%s %s %s", TOOLKIT_NAME, getVersion(), getClass().getSimpleName()));
            logger.info("Command line: " + commandLine);
            logger.info(String.format("Java %s on %s %s", System.getProperty("java.version"),
                    System.getProperty("os.name"), System.getProperty("os.arch")));
        }
        boolean completed = false;
        try {
            final Object result = doWork();
            completed = true;
            return result;
        } finally {
            if (!QUIET) {
                final Duration elapsed = Duration.between(start, Instant.now());
                logger.info(String.format("%s %s after %.2f seconds", getClass().getSimpleName(),
                        completed ? "done" : "failed", elapsed.toMillis() / 1000.0));
            }
        }
    }

    /**
     * @return the jar manifest version, or {@code unknown version} when run from classes
     */
    public String getVersion() {
        final Package pkg = getClass().getPackage();
        final String version = pkg == null ? null : pkg.getImplementationVersion();
        return version == null ? "unknown version" : version;
    }

    /**
     * @return the command line as parsed, {@code null} before parsing
     */
    public final String getCommandLine() {
        return commandLine;
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    @Override
    public List<? extends CommandLinePluginDescriptor<?>> getPluginDescriptors() {
        return Collections.emptyList();
    }

    private CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, getPluginDescriptors(), Collections.emptySet());
        }
        return commandLineParser;
    }
}

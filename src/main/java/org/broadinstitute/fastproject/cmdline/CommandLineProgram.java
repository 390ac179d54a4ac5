package org.broadinstitute.fastproject.cmdline;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.fastproject.utils.LoggingUtils;

import java.text.DecimalFormat;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Collections;

/**
 * Base class of every FastProject tool.
 *
 * A tool declares its inputs as {@link Argument} and {@link ArgumentCollection} fields. After parsing,
 * {@link #customCommandLineValidation()} may reject combinations the parser cannot express, then
 * {@link #onStartup()} runs followed by {@link #doWork()}, whose return value is handed back to {@code Main}.
 * Exceptions thrown by either propagate to the caller.
 */
public abstract class CommandLineProgram {

    // instance field so log lines carry the concrete tool's name
    protected final Logger logger = LogManager.getLogger(this.getClass());

    private static final String TOOLKIT_NAME = "FastProject";
    private static final String RULE = StringUtils.repeat('-', 60);
    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.LONG);

    @ArgumentCollection(doc = "Special arguments that have meaning to the argument parsing system.")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME,
            doc = "Control verbosity of logging.", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress the run summary on System.err.", common = true)
    public Boolean QUIET = false;

    private CommandLineParser commandLineParser;
    private String commandLine;

    /**
     * Hook for validation and setup that must happen after parsing and before any input is read.
     */
    protected void onStartup() {}

    /**
     * Runs the tool.
     * @return a result object, or null
     */
    protected abstract Object doWork();

    /**
     * @return null if the parsed arguments are consistent, otherwise one message per problem.
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses {@code argv} and runs the tool.
     * @return the result of {@link #doWork()}, or 0 when only help or version was requested.
     * @throws CommandLineException if the arguments are malformed or fail validation.
     */
    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 0;
        }
        final ZonedDateTime start = ZonedDateTime.now();
        LoggingUtils.setLoggingLevel(VERBOSITY);
        if (!QUIET) {
            printStartupMessage(start);
        }
        try {
            onStartup();
            return doWork();
        } finally {
            if (!QUIET) {
                printRunSummary(start);
            }
        }
    }

    private boolean parseArgs(final String[] argv) {
        final boolean run = getCommandLineParser().parseArguments(System.err, argv);
        commandLine = getCommandLineParser().getCommandLine();
        if (!run) {
            return false;
        }
        final String[] problems = customCommandLineValidation();
        if (problems != null) {
            throw new CommandLineException("Command Line Validation failed: " + String.join(", ", problems));
        }
        return true;
    }

    private void printStartupMessage(final ZonedDateTime start) {
        logger.info(RULE);
        logger.info(String.format("%s v%s", TOOLKIT_NAME, getVersion()));
        logger.info(String.format("Java runtime: %s v%s on %s %s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version"),
                System.getProperty("os.name"), System.getProperty("os.arch")));
        logger.info("Start Date/Time: " + start.format(DISPLAY_TIME));
        logger.info(RULE);
        if (commandLine != null) {
            logger.info("Command line: " + commandLine);
        }
    }

    private void printRunSummary(final ZonedDateTime start) {
        final ZonedDateTime end = ZonedDateTime.now();
        final double minutes = Duration.between(start, end).toMillis() / 60_000d;
        System.err.println("[" + end.format(DISPLAY_TIME) + "] " + getClass().getSimpleName()
                + " done. Elapsed time: " + new DecimalFormat("#,##0.00").format(minutes) + " minutes.");
    }

    /**
     * @return the jar manifest's implementation version, or "Unavailable" when running from classes.
     */
    public String getVersion() {
        final String version = getClass().getPackage().getImplementationVersion();
        return version != null ? version : "Unavailable";
    }

    /**
     * @return the command line as reconstructed by the parser, or null before parsing.
     */
    public final String getCommandLine() {
        return commandLine;
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    private CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}

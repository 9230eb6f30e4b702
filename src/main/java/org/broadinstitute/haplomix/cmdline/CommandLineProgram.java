package org.broadinstitute.haplomix.cmdline;

import com.google.common.annotations.VisibleForTesting;
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
import org.broadinstitute.haplomix.utils.LoggingUtils;
import org.broadinstitute.haplomix.utils.Utils;

import java.text.DecimalFormat;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract class to facilitate writing command-line programs.
 *
 * To use:
 *
 * 1. Extend this class with a concrete class that has data members annotated with @Argument
 * and/or @ArgumentCollection annotations.
 *
 * 2. Validate and build anything the arguments configure in onStartup(). Argument collections throw
 * {@link CommandLineException} for values the parser cannot check, which Main reports as a usage error.
 *
 * 3. Implement a method doWork().  This is called after successful command-line processing.
 * doWork() may throw unchecked exceptions, which are NOT caught and passed onto the caller.
 */
public abstract class CommandLineProgram implements CommandLinePluginProvider {

    // Logger is a protected instance variable here to output the correct class name
    // with concrete sub-classes of CommandLineProgram.
    protected final Logger logger = LogManager.getLogger(this.getClass());

    private static final String TOOLKIT_NAME = "Haplomix";

    @ArgumentCollection(doc="Special Arguments that have meaning to the argument parsing system.  " +
            "It is unlikely these will ever need to be accessed by the command line program")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME, doc = "Control verbosity of logging.", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress job-summary info on System.err.", common=true)
    public Boolean QUIET = false;

    private CommandLineParser commandLineParser;

    /**
     * Perform initialization/setup after command-line argument parsing but before doWork() is invoked.
     * Default implementation does nothing.
     */
    protected void onStartup() {}

    /**
     * Do the work after command line has been parsed.
     * @return the return value or null is there is none.
     */
    protected abstract Object doWork();

    /**
     * Perform cleanup after doWork() is finished. Always executes even if an exception is thrown during the run.
     * Default implementation does nothing.
     */
    protected void onShutdown() {}

    /**
     * Template method that runs the startup hook, doWork and then the shutdown hook.
     */
    public final Object runTool(){
        try {
            onStartup();
            return doWork();
        } finally {
            onShutdown();
        }
    }

    public Object instanceMainPostParseArgs() {
        final ZonedDateTime startDateTime = ZonedDateTime.now();

        LoggingUtils.setLoggingLevel(VERBOSITY);  // propagate the VERBOSITY level to logging frameworks

        if (!QUIET) {
            printStartupMessage(startDateTime);
        }

        try {
            return runTool();
        } finally {
            // Emit the time even if program throws
            if (!QUIET) {
                final ZonedDateTime endDateTime = ZonedDateTime.now();
                final double elapsedMinutes = (Duration.between(startDateTime, endDateTime).toMillis()) / (1000d * 60d);
                final String elapsedString  = new DecimalFormat("#,##0.00").format(elapsedMinutes);
                System.err.println("[" + Utils.getDateTimeForDisplay(endDateTime) + "] " +
                        getClass().getName() + " done. Elapsed time: " + elapsedString + " minutes.");
            }
        }
    }

    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            //an information only argument like help or version was specified, just exit
            return 0;
        }
        return instanceMainPostParseArgs();
    }

    /**
     * Parse arguments and initialize any values annotated with {@link Argument}
     * @return true if program should be executed, false if an information only argument like --help was specified
     * @throws CommandLineException if command line validation fails
     */
    protected final boolean parseArgs(final String[] argv) {
        return getCommandLineParser().parseArguments(System.err, argv);
    }

    /**
     * No tool in this toolkit takes plugins.
     */
    @Override
    public List<? extends CommandLinePluginDescriptor<?>> getPluginDescriptors() { return new ArrayList<>(); }

    /**
     * Prints a user-friendly message on startup with some information about who we are and the
     * runtime environment.
     *
     * @param startDateTime Startup date/time
     */
    protected void printStartupMessage(final ZonedDateTime startDateTime) {
        logger.info(Utils.dupChar('-', 60));
        logger.info(String.format("%s v%s", TOOLKIT_NAME, getVersion()));
        logger.info(String.format("Executing as %s on %s v%s %s",
                System.getProperty("user.name"),
                System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch")));
        logger.info(String.format("Java runtime: %s v%s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version")));
        logger.info("Start Date/Time: " + Utils.getDateTimeForDisplay(startDateTime));
        logger.info(Utils.dupChar('-', 60));
    }

    /**
     * @return the version of this tool as stored in the jar manifest, or "Unavailable" when not running from a jar
     */
    public String getVersion() {
        final String version = getClass().getPackage().getImplementationVersion();
        return version != null ? version : "Unavailable";
    }

    /**
     * @return get usage and help information for this command line program if it is available
     */
    public final String getUsage(){
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    /**
     * @return this programs CommandLineParser.  If one is not initialized yet this will initialize it.
     */
    @VisibleForTesting
    public final CommandLineParser getCommandLineParser() {
        if( commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, getPluginDescriptors(), Collections.emptySet());
        }
        return commandLineParser;
    }
}

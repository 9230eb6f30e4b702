package org.broadinstitute.haplomix;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.haplomix.cmdline.CommandLineProgram;
import org.broadinstitute.haplomix.exceptions.HaplomixException;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.broadinstitute.haplomix.tools.EstimateHaplogroupMixture;
import org.broadinstitute.haplomix.tools.SummarizePhylotree;
import org.broadinstitute.haplomix.utils.Utils;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * This is the main class of Haplomix and is the way of executing individual command line programs.
 *
 * The first argument names the program to run (by its simple class name); the remaining arguments are passed to it.
 * With no arguments, or with {@code -h}/{@code --help}, the available programs are listed.
 */
public class Main {

    static {
        // force the JVM locale into US English so that number formatting is stable
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "HAPLOMIX_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * similarity floor for matching in getSuggestedAlternateCommand
     */
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, final String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The programs we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Arrays.asList(SummarizePhylotree.class, EstimateHaplogroupMixture.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "haplomix";
    }

    /**
     * Runs the program named by the first argument with the rest of the arguments.
     *
     * This method is not intended to be used outside of the toolkit and tests: exceptions propagate to the caller.
     *
     * @return the result of the program, or null if no program was run
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = extractCommandLineProgram(args);
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running  {program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and handle the returned object with {@link #handleResult(Object)}, and exit with 0.
     * If any error occurs, it handles the exception and exits with the matching error exit value.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from a test harness)
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args);
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     * @param result the result of the tool (may be null)
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * @param e the exception to handle
     */
    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if (printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     * @param exception the exception to handle (never an {@link UserException}).
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point to Haplomix from commandline. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }

    /**
     * Returns the command line program specified, or null after printing the usage if none was requested.
     *
     * @throws UserException if the first argument does not name a program
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        Utils.nonNull(args);
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : getClassList()) {
            if (getProgramProperty(clazz) == null) {
                throw new HaplomixException("The class '" + clazz.getSimpleName() + "' is missing the required CommandLineProgramProperties annotation.");
            }
            if (simpleNameToClass.put(clazz.getSimpleName(), clazz) != null) {
                throw new HaplomixException("Simple class name collision: " + clazz.getName());
            }
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass.values());
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass.values());
            throw new UserException(getSuggestedAlternateCommand(simpleNameToClass.keySet(), args[0]));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new HaplomixException("Could not instantiate " + clazz.getName(), e);
        }
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private void printUsage(final PrintStream destinationStream, final Iterable<Class<? extends CommandLineProgram>> classes) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(getCommandLineName()).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");

        // group programs by their program group, both in name order
        final Map<String, CommandLineProgramGroup> groupsByName = new TreeMap<>();
        final Map<String, List<Class<?>>> programsByGroup = new TreeMap<>();
        for (final Class<? extends CommandLineProgram> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup programGroup;
            try {
                programGroup = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new HaplomixException("Could not instantiate program group " + property.programGroup().getName(), e);
            }
            groupsByName.putIfAbsent(programGroup.getName(), programGroup);
            programsByGroup.computeIfAbsent(programGroup.getName(), name -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<String, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = groupsByName.get(entry.getKey());
            builder.append("--------------------------------------------------------------------------------------\n");
            builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));

            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            sortedClasses.sort(Comparator.comparing(Class::getSimpleName));
            for (final Class<?> clazz : sortedClasses) {
                builder.append(String.format("    %-45s%s\n", clazz.getSimpleName(), getProgramProperty(clazz).oneLineSummary()));
            }
            builder.append("\n");
        }
        builder.append("--------------------------------------------------------------------------------------\n");
        destinationStream.println(builder);
    }

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT
     * @return returns an error message including the closest match if relevant.
     */
    public String getSuggestedAlternateCommand(final Iterable<String> programNames, final String command) {
        final Map<String, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;
        int total = 0;

        for (final String name : programNames) {
            total++;
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(name, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == total) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder();
        message.append(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            message.append(System.lineSeparator());
            for (final Map.Entry<String, Integer> entry : distances.entrySet()) {
                if (bestDistance == entry.getValue()) {
                    message.append(String.format("        %s", entry.getKey()));
                }
            }
        }
        return message.toString();
    }
}

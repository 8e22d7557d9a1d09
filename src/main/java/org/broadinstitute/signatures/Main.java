package org.broadinstitute.signatures;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.signatures.cmdline.CommandLineProgram;
import org.broadinstitute.signatures.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;
import org.broadinstitute.signatures.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * This is the main class of the toolkit and is responsible for parsing command line arguments and launching
 * the appropriate tool, selected by its simple class name as the first argument.
 */
public class Main {

    static {
        // Force the locale so that numbers in the output tables are formatted the same everywhere.
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    private static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * exit value when an unrecoverable {@link UserException} occurs
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    private static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "SIGNATURES_STACKTRACE_ON_USER_EXCEPTION";

    private static final int HELP_SIMILARITY_FLOOR = 7;

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
     * The packages we wish to include in our command line.
     */
    protected List<String> getPackageList() {
        return Collections.singletonList("org.broadinstitute.signatures");
    }

    /**
     * The single classes we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.emptyList();
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "signatures";
    }

    /**
     * Sets up the configuration from the arguments, then finds and runs the requested program.
     *
     * @return the value returned by the program, or null if only the program list was requested.
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args);
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs thse are the raw arguments from the command line, the first will be stripped off
     * @return the result of running {code program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    private CommandLineProgram setupConfigAndExtractProgram(final String[] args) {
        // The configuration must be loaded before any program is instantiated, as argument defaults read it.
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION);
        return extractCommandLineProgram(args);
    }

    /**
     * This method is not intended to be used outside of the main entry point.
     * It calls System.exit with a non-zero value on any failure.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args);
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
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /**
     * Handle a UserException or a CommandLineException.
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

    /** The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line program. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getSignaturesConfig().stacktrace_on_user_exception();
    }

    /**
     * Finds the command line program named by the first argument.
     *
     * @return null if no program was named and the list of programs was printed instead
     * @throws UserException if there is no program with that name
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<?>> simpleNameToClass = findProgramClasses();

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass.values());
            return null;
        }

        final Class<?> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass.values());
            throw new UserException(getSuggestedAlternateCommand(simpleNameToClass.keySet(), args[0]));
        }
        try {
            return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    private Map<String, Class<?>> findProgramClasses() {
        final ClassFinder classFinder = new ClassFinder();
        for (final String pkg : getPackageList()) {
            classFinder.find(pkg, CommandLineProgram.class);
        }
        final Set<Class<?>> toCheck = new LinkedHashSet<>(classFinder.getClasses());
        toCheck.addAll(getClassList());

        final Map<String, Class<?>> simpleNameToClass = new TreeMap<>();
        final List<String> missingAnnotationClasses = new ArrayList<>();
        for (final Class<?> clazz : toCheck) {
            if (!canMakeInstances(clazz)) {
                continue;
            }
            if (getProgramProperty(clazz) == null) {
                missingAnnotationClasses.add(clazz.getSimpleName());
            } else if (simpleNameToClass.put(clazz.getSimpleName(), clazz) != null) {
                throw new RuntimeException("Simple class name collision: " + clazz.getName());
            }
        }
        if (!missingAnnotationClasses.isEmpty()) {
            throw new RuntimeException("The following classes are missing the required CommandLineProgramProperties annotation: " + String.join(", ", missingAnnotationClasses));
        }
        return simpleNameToClass;
    }

    private static boolean canMakeInstances(final Class<?> clazz) {
        return clazz != null && !clazz.isPrimitive() && !clazz.isSynthetic() && !clazz.isInterface()
                && !clazz.isLocalClass() && !Modifier.isAbstract(clazz.getModifiers());
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private void printUsage(final PrintStream destinationStream, final Collection<Class<?>> classes) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(getCommandLineName()).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");

        final Map<String, CommandLineProgramGroup> groupsByName = new TreeMap<>();
        final Map<String, List<Class<?>>> programsByGroup = new TreeMap<>();
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup programGroup;
            try {
                programGroup = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final ReflectiveOperationException e) {
                throw new RuntimeException(e);
            }
            groupsByName.putIfAbsent(programGroup.getName(), programGroup);
            programsByGroup.computeIfAbsent(programGroup.getName(), k -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<String, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = groupsByName.get(entry.getKey());
            builder.append(Utils.dupChar('-', 86)).append('\n');
            builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));
            entry.getValue().sort(Comparator.comparing(Class::getSimpleName));
            for (final Class<?> clazz : entry.getValue()) {
                builder.append(String.format("    %-45s%s\n", clazz.getSimpleName(), getProgramProperty(clazz).oneLineSummary()));
            }
            builder.append('\n');
        }
        builder.append(Utils.dupChar('-', 86)).append('\n');
        destinationStream.println(builder);
    }

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT
     * @return returns an error message including the closes match if relevant.
     */
    public String getSuggestedAlternateCommand(final Set<String> programNames, final String command) {
        final Map<String, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        for (final String name : programNames) {
            final int distance = name.startsWith(command) ? 0 : StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            distances.put(name, distance);
            bestDistance = Math.min(bestDistance, distance);
        }

        final StringBuilder message = new StringBuilder();
        message.append(String.format("'%s' is not a valid command.", command));
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("%nDid you mean %s?", bestDistance == 0 ? "one of these" : "this"));
            for (final Map.Entry<String, Integer> entry : distances.entrySet()) {
                if (entry.getValue() == bestDistance) {
                    message.append(String.format("%n        %s", entry.getKey()));
                }
            }
        }
        return message.toString();
    }
}

package org.broadinstitute.fastproject;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.fastproject.cmdline.CommandLineProgram;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.exceptions.UserException;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Command line entry point. The first argument names a tool (the simple name of a {@link CommandLineProgram}
 * annotated with {@link CommandLineProgramProperties} under {@value #TOOL_PACKAGE}); the rest are its arguments.
 *
 * Exit values: 0 on success, {@value #COMMANDLINE_EXCEPTION_EXIT_VALUE} for command line errors,
 * {@value #USER_EXCEPTION_EXIT_VALUE} for {@link UserException}s and {@value #ANY_OTHER_EXCEPTION_EXIT_VALUE}
 * for anything else.
 */
public class Main {

    static {
        // numbers in output tables are always written in US format
        Locale.setDefault(Locale.US);
    }

    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    static final String TOOL_PACKAGE = "org.broadinstitute.fastproject";
    private static final String COMMAND_NAME = "fastproject";
    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "FASTPROJECT_STACKTRACE_ON_USER_EXCEPTION";
    private static final String BANNER = StringUtils.repeat('*', 71);
    private static final String RULE = StringUtils.repeat('-', 86);

    /**
     * Runs the named tool without any exit code handling; exceptions propagate.
     * @return the tool's result, or null when only the usage was printed.
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = findTool(args);
        return program == null ? null : program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    /**
     * Runs the named tool, prints its result and any error, and returns the exit value.
     */
    protected final int mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = findTool(args);
            if (program != null) {
                final Object result = program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
                if (result != null) {
                    System.out.println("Tool returned:\n" + result);
                }
            }
            return 0;
        } catch (final CommandLineException e) {
            if (program != null) {
                System.err.println(program.getUsage());
            }
            reportUserError(e);
            return COMMANDLINE_EXCEPTION_EXIT_VALUE;
        } catch (final UserException e) {
            reportUserError(e);
            return USER_EXCEPTION_EXIT_VALUE;
        } catch (final Exception e) {
            e.printStackTrace();
            return ANY_OTHER_EXCEPTION_EXIT_VALUE;
        }
    }

    public static void main(final String[] args) {
        final int exitValue = new Main().mainEntry(args);
        if (exitValue != 0) {
            System.exit(exitValue);
        }
    }

    private static void reportUserError(final Exception e) {
        System.err.println(BANNER);
        System.err.println();
        System.err.println("A USER ERROR has occurred: " + e.getMessage());
        System.err.println();
        System.err.println(BANNER);
        if ("true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) {
            e.printStackTrace();
        } else {
            System.err.printf("Set the system property %s (-D%s=true) to print the stack trace.%n",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
        }
    }

    /**
     * @return a new instance of the tool named by {@code args[0]}, or null after printing the usage when no tool
     *         or help was requested.
     * @throws UserException if no tool has that name.
     */
    private static CommandLineProgram findTool(final String[] args) {
        final Map<String, Class<?>> tools = discoverTools();
        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, tools);
            return null;
        }
        final Class<?> tool = tools.get(args[0]);
        if (tool == null) {
            printUsage(System.err, tools);
            throw new UserException(String.format("'%s' is not a valid command.", args[0]));
        }
        return (CommandLineProgram) instantiate(tool);
    }

    /**
     * Tool simple name to class, sorted by name.
     */
    private static Map<String, Class<?>> discoverTools() {
        final ClassFinder classFinder = new ClassFinder();
        classFinder.find(TOOL_PACKAGE, CommandLineProgram.class);
        final Map<String, Class<?>> tools = new TreeMap<>();
        for (final Class<?> clazz : classFinder.getClasses()) {
            final int modifiers = clazz.getModifiers();
            if (clazz.isInterface() || clazz.isLocalClass() || clazz.isSynthetic()
                    || Modifier.isAbstract(modifiers) || !Modifier.isPublic(modifiers)) {
                continue;
            }
            if (clazz.getAnnotation(CommandLineProgramProperties.class) == null) {
                throw new FastProjectException(String.format("The tool %s is missing its CommandLineProgramProperties annotation.", clazz.getName()));
            }
            if (tools.put(clazz.getSimpleName(), clazz) != null) {
                throw new FastProjectException("Two tools share the simple name " + clazz.getSimpleName());
            }
        }
        return tools;
    }

    private static Object instantiate(final Class<?> clazz) {
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new FastProjectException("Could not create an instance of " + clazz.getName(), e);
        }
    }

    private static void printUsage(final PrintStream out, final Map<String, Class<?>> tools) {
        final Map<CommandLineProgramGroup, List<Class<?>>> byGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        final Map<Class<?>, CommandLineProgramGroup> groups = new TreeMap<>(Comparator.comparing(Class::getName));
        for (final Class<?> tool : tools.values()) {
            final CommandLineProgramProperties properties = tool.getAnnotation(CommandLineProgramProperties.class);
            if (properties.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup group = groups.computeIfAbsent(properties.programGroup(),
                    groupClass -> (CommandLineProgramGroup) instantiate(groupClass));
            byGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(tool);
        }

        final StringBuilder usage = new StringBuilder();
        usage.append("USAGE: ").append(COMMAND_NAME).append(" <program name> [-h]\n\nAvailable Programs:\n");
        byGroup.forEach((group, groupTools) -> {
            usage.append(RULE).append('\n');
            usage.append(String.format("%-48s %-45s%n", group.getName() + ":", group.getDescription()));
            for (final Class<?> tool : groupTools) {
                usage.append(String.format("    %-45s%s%n", tool.getSimpleName(),
                        tool.getAnnotation(CommandLineProgramProperties.class).oneLineSummary()));
            }
            usage.append('\n');
        });
        usage.append(RULE);
        out.println(usage);
    }
}

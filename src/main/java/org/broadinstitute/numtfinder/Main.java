package org.broadinstitute.numtfinder;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.numtfinder.cmdline.CommandLineProgram;
import org.broadinstitute.numtfinder.exceptions.UserException;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Command line entry point of NUMTFinder: {@code numtfinder <Tool> [arguments]}.
 *
 * Tools are the annotated {@link CommandLineProgram} subclasses found in {@link #getPackageList()}, selected by
 * their simple class name.
 */
public class Main {

    /** Exit value for a {@link CommandLineException}: bad or missing arguments. */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /** Exit value for a {@link UserException}: unreadable or malformed input, unwritable output. */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /** Exit value for anything else. */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "NUMTFINDER_STACKTRACE_ON_USER_EXCEPTION";

    // suggestions must be closer than this, see getSuggestedAlternateCommand
    private static final int SUGGESTION_DISTANCE_LIMIT = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    protected List<String> getPackageList() {
        return Collections.singletonList("org.broadinstitute.numtfinder.tools");
    }

    protected String getCommandLineName() {
        return "numtfinder";
    }

    /**
     * Runs the tool named by {@code args[0]} on the remaining arguments and returns its result. Exceptions
     * propagate; only {@link #mainEntry} turns them into exit values.
     *
     * @return {@code null} when no tool was named and the usage was printed
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = selectProgram(args);
        return program == null ? null : program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    /**
     * Runs {@link #instanceMain} and exits with the value matching the failure, if any. The only caller of
     * {@link System#exit}.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = selectProgram(args);
            if (program != null) {
                final Object result = program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
                if (result != null) {
                    System.out.println(result);
                }
            }
        } catch (final CommandLineException e) {
            if (program != null) {
                System.err.println(program.getUsage());
            }
            reportUserError(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e) {
            reportUserError(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e) {
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    private static void reportUserError(final Exception e) {
        final String rule = StringUtil.repeatCharNTimes('*', 72);
        System.err.println(rule);
        System.err.println("A USER ERROR has occurred: " + e.getMessage());
        System.err.println(rule);
        if (Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))) {
            e.printStackTrace();
        } else {
            System.err.println(String.format("Set -D%s=true to print the stack trace.", STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * @return every concrete {@link CommandLineProgram} in the packages, keyed by simple name
     * @throws IllegalStateException if one lacks {@link CommandLineProgramProperties} or two share a simple name
     */
    static Map<String, Class<?>> findCommandLinePrograms(final List<String> packageList) {
        final ClassFinder classFinder = new ClassFinder();
        packageList.forEach(pkg -> classFinder.find(pkg, CommandLineProgram.class));
        final Map<String, Class<?>> programs = new TreeMap<>();
        for (final Class<?> clazz : classFinder.getClasses()) {
            if (clazz.isInterface() || clazz.isSynthetic() || clazz.isLocalClass() || Modifier.isAbstract(clazz.getModifiers())) {
                continue;
            }
            if (getProgramProperty(clazz) == null) {
                throw new IllegalStateException(clazz.getName() + " is missing the CommandLineProgramProperties annotation");
            }
            if (programs.put(clazz.getSimpleName(), clazz) != null) {
                throw new IllegalStateException("two tools are named " + clazz.getSimpleName());
            }
        }
        return programs;
    }

    static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    /**
     * @return the tool named by {@code args[0]}, or {@code null} after printing the usage if none was named
     * @throws UserException if no tool has that name
     */
    private CommandLineProgram selectProgram(final String[] args) {
        final Map<String, Class<?>> programs = findCommandLinePrograms(getPackageList());
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, programs.values());
            return null;
        }
        final Class<?> clazz = programs.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, programs.values());
            throw new UserException(getSuggestedAlternateCommand(programs.keySet(), args[0]));
        }
        try {
            return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("cannot instantiate " + clazz.getName(), e);
        }
    }

    private void printUsage(final PrintStream out, final Collection<Class<?>> programs) {
        final Map<String, List<Class<?>>> byGroup = new TreeMap<>();
        final Map<String, String> groupDescriptions = new TreeMap<>();
        for (final Class<?> clazz : programs) {
            final CommandLineProgramProperties properties = getProgramProperty(clazz);
            if (properties.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup group;
            try {
                group = properties.programGroup().getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new IllegalStateException("cannot instantiate " + properties.programGroup().getName(), e);
            }
            groupDescriptions.put(group.getName(), group.getDescription());
            byGroup.computeIfAbsent(group.getName(), k -> new ArrayList<>()).add(clazz);
        }

        final StringBuilder usage = new StringBuilder();
        usage.append("USAGE: ").append(getCommandLineName()).append(" <tool> [-h]\n\nAvailable tools:\n");
        byGroup.forEach((groupName, members) -> {
            usage.append(String.format("%s: %s\n", groupName, groupDescriptions.get(groupName)));
            members.forEach(clazz -> usage.append(String.format("    %-30s%s\n",
                    clazz.getSimpleName(), getProgramProperty(clazz).oneLineSummary())));
        });
        out.println(usage);
    }

    /**
     * Builds the error message for an unknown tool, suggesting the closest tool names in the way git suggests
     * commands: names the command is a prefix or substring of come first, then the names with the smallest
     * edit distance below a limit.
     */
    public String getSuggestedAlternateCommand(final Set<String> names, final String command) {
        final Map<String, Integer> distances = names.stream().collect(Collectors.toMap(name -> name, name ->
                name.startsWith(command) || (command.length() >= MINIMUM_SUBSTRING_LENGTH && name.contains(command))
                        ? 0
                        : StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4)));
        final int best = distances.values().stream().min(Integer::compare).orElse(Integer.MAX_VALUE);
        final List<String> suggestions = distances.entrySet().stream()
                .filter(e -> e.getValue() == best)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());

        final StringBuilder message = new StringBuilder(String.format("'%s' is not a valid command.", command));
        // a command every name matches says nothing about which one was meant
        final boolean matchesAll = best == 0 && suggestions.size() == names.size() && names.size() > 1;
        if (best < SUGGESTION_DISTANCE_LIMIT && !matchesAll) {
            message.append(System.lineSeparator())
                    .append(suggestions.size() == 1 ? "Did you mean this?" : "Did you mean one of these?");
            suggestions.forEach(s -> message.append(System.lineSeparator()).append("        ").append(s));
        }
        return message.toString();
    }
}

package org.broadinstitute.numtfinder.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.numtfinder.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists, with shortcuts for the standard reference and output arguments.
 *
 * Use this only in test code.
 */
public final class ArgumentsBuilder {
    private final List<String> args = new ArrayList<>();

    public ArgumentsBuilder() {}

    /**
     * Adds one or more whitespace separated arguments as they are.
     */
    public ArgumentsBuilder addRaw(final String arg) {
        args.addAll(Arrays.asList(StringUtils.split(arg.trim())));
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentName);
        Utils.nonNull(argumentValue);
        args.add("--" + argumentName);
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file) {
        Utils.nonNull(file);
        return add(argumentName, file.getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final boolean yes) {
        return add(argumentName, String.valueOf(yes));
    }

    public ArgumentsBuilder add(final String argumentName, final Number value) {
        Utils.nonNull(value);
        return add(argumentName, value.toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Enum<?> value) {
        Utils.nonNull(value);
        return add(argumentName, value.name());
    }

    public ArgumentsBuilder addReference(final File reference) {
        return add(StandardArgumentDefinitions.REFERENCE_LONG_NAME, reference);
    }

    public ArgumentsBuilder addOutput(final File output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    public ArgumentsBuilder addFlag(final String argumentName) {
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        return this;
    }

    public List<String> getArgsList() {
        return args;
    }

    public String[] getArgsArray() {
        return args.toArray(new String[0]);
    }

    @Override
    public String toString() {
        return String.join(" ", args);
    }
}

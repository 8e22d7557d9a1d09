package org.broadinstitute.signatures.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.signatures.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.signatures.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists with convenience methods for the standard arguments.
 *
 * Use this only in test code.
 */
public final class ArgumentsBuilder {
    private final List<String> args = new ArrayList<>();

    public ArgumentsBuilder() {}

    /**
     * Add a string to the arguments list, split on whitespace.
     */
    public ArgumentsBuilder addRaw(final String arg) {
        args.addAll(Arrays.asList(StringUtils.split(arg.trim())));
        return this;
    }

    /**
     * add an argument with a given value to this builder. It adds dashes to the argument name.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentValue);
        Utils.nonNull(argumentName);
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

    public ArgumentsBuilder addInput(final String input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addOutput(final File output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    public ArgumentsBuilder addReference(final String reference) {
        return add(StandardArgumentDefinitions.REFERENCE_LONG_NAME, reference);
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

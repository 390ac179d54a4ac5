package org.broadinstitute.fastproject.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.fastproject.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Assembles command lines for tool tests, e.g.
 * {@code new ArgumentsBuilder().addRaw("AnalyzeSignatures").addInput(expression).addSignatures(gmt).getArgsArray()}.
 */
public final class ArgumentsBuilder {
    private final List<String> args = new ArrayList<>();

    /**
     * Appends the whitespace-separated tokens of {@code arg} unchanged, e.g. a tool name.
     */
    public ArgumentsBuilder addRaw(final String arg) {
        args.addAll(Arrays.asList(StringUtils.split(arg.trim())));
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentName);
        Utils.nonNull(argumentValue, () -> "no value for --" + argumentName);
        args.add("--" + argumentName);
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file) {
        return add(argumentName, Utils.nonNull(file).getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final Number value) {
        return add(argumentName, Utils.nonNull(value).toString());
    }

    /**
     * Boolean arguments take an explicit value on the command line.
     */
    public ArgumentsBuilder add(final String argumentName, final boolean value) {
        return add(argumentName, Boolean.toString(value));
    }

    public ArgumentsBuilder addInput(final File expression) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, expression);
    }

    public ArgumentsBuilder addSignatures(final File gmt) {
        return add(StandardArgumentDefinitions.SIGNATURES_LONG_NAME, gmt);
    }

    public String[] getArgsArray() {
        return args.toArray(new String[0]);
    }

    @Override
    public String toString() {
        return String.join(" ", args);
    }
}

package org.broadinstitute.signatures;

import htsjdk.samtools.util.Log;
import org.broadinstitute.signatures.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.signatures.testutils.ArgumentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for command line program testing: runs the tested tool through {@link Main}.
 */
public abstract class CommandLineProgramTest extends SignaturesBaseTest {

    public String getTestedToolName() {
        return getTestedClassName();
    }

    public Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(makeCommandLineArgs(args, getTestedToolName()));
    }

    public Object runCommandLine(final ArgumentsBuilder args) {
        return runCommandLine(args.getArgsList());
    }

    /**
     * Builds "toolname args", adding a low verbosity unless one was given.
     */
    public static String[] makeCommandLineArgs(final List<String> args, final String toolName) {
        final List<String> curatedArgs = new ArrayList<>();
        curatedArgs.add(toolName);
        curatedArgs.addAll(args);
        if (args.stream().noneMatch(arg -> arg.equalsIgnoreCase("--" + StandardArgumentDefinitions.VERBOSITY_NAME))) {
            curatedArgs.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
            curatedArgs.add(Log.LogLevel.ERROR.name());
        }
        return curatedArgs.toArray(new String[0]);
    }
}

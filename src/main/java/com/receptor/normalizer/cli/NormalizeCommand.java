package com.receptor.normalizer.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top level command; the work happens in the subcommands.
 */
@Command(
        name = "receptor-normalizer",
        mixinStandardHelpOptions = true,
        version = "receptor-normalizer 1.0.0",
        description = "Standardizes TR, IG and MH gene symbols and CDR3 junction sequences.",
        subcommands = { SymbolCommand.class, JunctionCommand.class, QueryCommand.class, SequenceCommand.class }
)
public class NormalizeCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_INVALID_OPTIONS;
    }
}

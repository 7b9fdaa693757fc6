package com.receptor.normalizer;

import com.receptor.normalizer.cli.NormalizeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the receptor nomenclature normalizer.
 */
public class NormalizerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NormalizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}

package com.receptor.normalizer.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every subcommand.
 */
@Getter
public class CommonOptions {

    @Option(names = { "--catalog-dir" }, description = "Directory with catalog JSON files (defaults to the bundled catalogs)")
    private Path catalogDir;

    @Option(names = { "--report", "-r" }, description = "Also write a batch report to this file")
    private Path report;

    @Option(names = { "--quiet", "-q" }, description = "Do not log failed standardizations")
    private boolean quiet;
}

package com.receptor.normalizer.cli.model;

import com.receptor.normalizer.catalog.GeneFamily;
import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options of the "sequence" command.
 */
@Getter
public class SequenceOptions {

    @Parameters(paramLabel = "SYMBOL", index = "0", description = "Allele symbol, for example TRBJ2-7*01")
    private String symbol;

    @Option(names = { "--family", "-f" }, defaultValue = "TR", description = "Gene family: TR or IG (default: ${DEFAULT-VALUE})")
    private GeneFamily family;

    @Option(names = { "--species", "-s" }, defaultValue = "homosapiens", description = "Species key (default: ${DEFAULT-VALUE})")
    private String species;
}

package com.receptor.normalizer.cli.model;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.query.FunctionalityFilter;
import com.receptor.normalizer.symbol.Precision;
import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "query" command.
 */
@Getter
public class QueryOptions {

    @Option(names = { "--family", "-f" }, defaultValue = "TR", description = "Gene family: TR, IG or MH (default: ${DEFAULT-VALUE})")
    private GeneFamily family;

    @Option(names = { "--species", "-s" }, defaultValue = "homosapiens", description = "Species key (default: ${DEFAULT-VALUE})")
    private String species;

    @Option(names = { "--precision", "-p" }, defaultValue = "GENE", description = "Precision of the listed symbols (default: ${DEFAULT-VALUE})")
    private Precision precision;

    @Option(names = { "--functionality" }, defaultValue = "ANY", description = "ANY, F, NF, P or ORF (default: ${DEFAULT-VALUE})")
    private FunctionalityFilter functionality;

    @Option(names = { "--contains", "-c" }, description = "Regular expression the symbols must contain")
    private String contains;
}

package com.receptor.normalizer.cli.model;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.symbol.Precision;
import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Options of the "symbol" command.
 */
@Getter
public class SymbolOptions {

    @Parameters(paramLabel = "SYMBOL", arity = "1..*", description = "Gene symbols to standardize")
    private List<String> symbols;

    @Option(names = { "--family", "-f" }, defaultValue = "TR", description = "Gene family: TR, IG or MH (default: ${DEFAULT-VALUE})")
    private GeneFamily family;

    @Option(names = { "--species", "-s" }, defaultValue = "homosapiens", description = "Species key, or 'any' (default: ${DEFAULT-VALUE})")
    private String species;

    @Option(names = { "--enforce-functional" }, description = "Reject symbols without a functional allele")
    private boolean enforceFunctional;

    @Option(names = { "--allow-subgroup" }, description = "Accept subgroup-only symbols such as TRBV6")
    private boolean allowSubgroup;

    @Option(names = { "--precision", "-p" }, description = "Report at most this precision: SUBGROUP, GENE, PROTEIN or ALLELE")
    private Precision precision;
}

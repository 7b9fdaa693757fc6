package com.receptor.normalizer.cli.model;

import com.receptor.normalizer.junction.Locus;
import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Options of the "junction" command.
 */
@Getter
public class JunctionOptions {

    @Parameters(paramLabel = "SEQUENCE", arity = "1..*", description = "Junction amino acid sequences")
    private List<String> sequences;

    @Option(names = { "--locus", "-l" }, description = "Locus to align against (TRA, TRB, TRG, TRD, IGH, IGK, IGL, TR, IG); omitted means pattern check only")
    private Locus locus;

    @Option(names = { "--v-symbol" }, description = "Restrict V alignment to this gene, subgroup or allele")
    private String vSymbol;

    @Option(names = { "--j-symbol" }, description = "Restrict J alignment to this gene, subgroup or allele")
    private String jSymbol;

    @Option(names = { "--species", "-s" }, defaultValue = "homosapiens", description = "Species key (default: ${DEFAULT-VALUE})")
    private String species;

    @Option(names = { "--strict" }, description = "Without a locus, reject sequences that are not C...F/W instead of wrapping them")
    private boolean strict;

    @Option(names = { "--allow-c-correction" }, description = "Replace a wrong first residue with C when it improves the V alignment")
    private boolean allowCCorrection;

    @Option(names = { "--allow-fw-correction" }, description = "Replace a wrong last residue with F or W when it improves the J alignment")
    private boolean allowFwCorrection;

    @Option(names = { "--allow-v-reconstruction" }, description = "Allow restoring more than the conserved C from the V region")
    private boolean allowVReconstruction;

    @Option(names = { "--allow-j-reconstruction" }, description = "Allow restoring more than the conserved F/W from the J region")
    private boolean allowJReconstruction;

    @Option(names = { "--any-v-functionality" }, description = "Also align against non-functional V alleles")
    private boolean anyVFunctionality;

    @Option(names = { "--functional-j-only" }, description = "Only align against functional J alleles")
    private boolean functionalJOnly;

    @Option(names = { "--mismatch-penalty" }, defaultValue = "1.5", description = "Score cost of a mismatch (default: ${DEFAULT-VALUE})")
    private double mismatchPenalty;

    @Option(names = { "--max-j-mismatches" }, defaultValue = "1", description = "Mismatches tolerated in a J alignment (default: ${DEFAULT-VALUE})")
    private int maxJMismatches;

    @Option(names = { "--max-v-mismatches" }, defaultValue = "2", description = "Mismatches tolerated in a V alignment (default: ${DEFAULT-VALUE})")
    private int maxVMismatches;

    @Option(names = { "--min-j-score" }, defaultValue = "3", description = "Minimum J alignment score (default: ${DEFAULT-VALUE})")
    private int minJScore;

    @Option(names = { "--min-v-score" }, defaultValue = "2", description = "Minimum V alignment score (default: ${DEFAULT-VALUE})")
    private int minVScore;

    @Option(names = { "--min-length" }, defaultValue = "4", description = "Minimum junction length (default: ${DEFAULT-VALUE})")
    private int minLength;
}

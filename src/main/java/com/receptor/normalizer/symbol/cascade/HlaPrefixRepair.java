package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

/**
 * Adds the "HLA-" prefix and maps the retired Cw locus name to C.
 */
public class HlaPrefixRepair implements CorrectionStrategy {

    private static final String PREFIX = "HLA-";

    @Override
    public String name() {
        return "hla-prefix";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        String gene = symbol.getGene();
        if (!gene.startsWith(PREFIX)) {
            gene = PREFIX + gene;
        }
        return symbol.withGene(gene.replace("CW", "C"));
    }
}

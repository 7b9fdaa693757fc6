package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Renders parsed symbols at a requested precision. Compiling never fails; it
 * is also used to report the best attempted fix of a failed standardization.
 */
public enum PrecisionCompiler {

    /** TR and IG: {@code GENE*NN}, gene, or subgroup. */
    RECEPTOR(EnumSet.of(Precision.SUBGROUP, Precision.GENE, Precision.ALLELE)) {
        @Override
        public String compile(ParsedSymbol symbol, Precision precision) {
            return switch (precision) {
                case ALLELE, PROTEIN -> symbol.hasAllele()
                        ? symbol.getGene() + "*" + symbol.firstField()
                        : symbol.getGene();
                case GENE -> symbol.getGene();
                case SUBGROUP -> ReferenceCatalog.subgroupOf(symbol.getGene());
            };
        }
    },

    /** MH: colon separated fields, with the first two forming the protein. */
    MH(EnumSet.of(Precision.GENE, Precision.PROTEIN, Precision.ALLELE)) {
        @Override
        public String compile(ParsedSymbol symbol, Precision precision) {
            List<String> fields = symbol.getAlleleFields();
            return switch (precision) {
                case ALLELE -> fields.isEmpty()
                        ? symbol.getGene()
                        : symbol.getGene() + "*" + String.join(":", fields);
                case PROTEIN -> fields.isEmpty()
                        ? symbol.getGene()
                        : symbol.getGene() + "*" + String.join(":", fields.subList(0, Math.min(2, fields.size())));
                case GENE, SUBGROUP -> symbol.getGene();
            };
        }
    };

    private final Set<Precision> supported;

    PrecisionCompiler(Set<Precision> supported) {
        this.supported = supported;
    }

    public static PrecisionCompiler forFamily(GeneFamily family) {
        return family == GeneFamily.MH ? MH : RECEPTOR;
    }

    public abstract String compile(ParsedSymbol symbol, Precision precision);

    public Set<Precision> supportedPrecisions() {
        return supported;
    }

    public boolean supports(Precision precision) {
        return supported.contains(precision);
    }

    /**
     * Most specific precision the symbol actually carries.
     */
    public Precision highestPrecision(ParsedSymbol symbol) {
        if (symbol.hasAllele()) {
            return Precision.ALLELE;
        }
        return Precision.GENE;
    }
}

package com.receptor.normalizer.junction;

import com.receptor.normalizer.catalog.GeneFamily;

import java.util.Locale;

/**
 * Receptor loci a junction can be standardized against. The two letter loci
 * cover every chain of their family.
 */
public enum Locus {
    TRA(GeneFamily.TR),
    TRB(GeneFamily.TR),
    TRG(GeneFamily.TR),
    TRD(GeneFamily.TR),
    IGH(GeneFamily.IG),
    IGK(GeneFamily.IG),
    IGL(GeneFamily.IG),
    TR(GeneFamily.TR),
    IG(GeneFamily.IG);

    private final GeneFamily family;

    Locus(GeneFamily family) {
        this.family = family;
    }

    public GeneFamily getFamily() {
        return family;
    }

    public static Locus parse(String raw) {
        try {
            return Locus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown locus: " + raw, e);
        }
    }

    /**
     * Whether a catalogued symbol is a gene of the given segment in this locus.
     * Alpha and delta share their variable genes.
     */
    public boolean covers(String symbol, Segment segment) {
        if (symbol.length() < 4 || symbol.charAt(3) != segment.getCode()) {
            return false;
        }
        if (segment == Segment.V && (this == TRA || this == TRD)) {
            return symbol.startsWith("TRAV") || symbol.startsWith("TRDV");
        }
        return symbol.startsWith(name());
    }
}

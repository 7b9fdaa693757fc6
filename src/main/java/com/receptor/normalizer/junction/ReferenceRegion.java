package com.receptor.normalizer.junction;

/**
 * Reference V or J region with the index of its conserved anchor residue.
 *
 * @param label allele symbol, or gene name when all alleles share the region
 */
public record ReferenceRegion(String label, String sequence, int anchor) {

    public char anchorResidue() {
        return sequence.charAt(anchor);
    }
}

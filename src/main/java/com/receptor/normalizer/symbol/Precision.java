package com.receptor.normalizer.symbol;

/**
 * Specificity levels a resolved symbol can be rendered at, coarsest first.
 */
public enum Precision {
    SUBGROUP,
    GENE,
    PROTEIN,
    ALLELE
}

package com.receptor.normalizer.symbol;

/**
 * Why a parsed symbol was rejected by a validity oracle.
 */
public enum InvalidReason {
    UNSUPPORTED_SPECIES("unsupported species"),
    UNRECOGNIZED_GENE("unrecognized gene name"),
    IS_SUBGROUP("is subgroup"),
    NONEXISTENT_ALLELE("nonexistent allele for recognized gene"),
    NONFUNCTIONAL_ALLELE("nonfunctional allele"),
    NO_FUNCTIONAL_ALLELES("gene has no functional alleles"),
    TOO_MANY_DESIGNATORS("too many allele designators"),
    NON_NUMERICAL_DESIGNATORS("non-numerical allele designators"),
    NON_TWO_DIGIT_DESIGNATORS("non-2-digit allele designators");

    private final String message;

    InvalidReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}

package com.receptor.normalizer.symbol;

/**
 * Per-call switches consulted by validity oracles.
 */
public record ValidationOptions(boolean enforceFunctional, boolean allowSubgroup) {

    public static final ValidationOptions LENIENT = new ValidationOptions(false, false);
}

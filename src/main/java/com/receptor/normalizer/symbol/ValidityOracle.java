package com.receptor.normalizer.symbol;

import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.Optional;

/**
 * Answers whether a parsed symbol exists in a reference catalog. Implementations
 * are pure functions of their catalog and the input.
 */
public interface ValidityOracle {

    /**
     * @return the first reason the symbol is invalid, or empty when it is valid
     */
    Optional<InvalidReason> reasonInvalid(ParsedSymbol symbol, ValidationOptions options);

    /**
     * Test used by the resolution cascade to decide when to stop correcting.
     */
    boolean accepts(ParsedSymbol symbol, ValidationOptions options);

    default boolean isValid(ParsedSymbol symbol, ValidationOptions options) {
        return reasonInvalid(symbol, options).isEmpty();
    }
}

package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.symbol.Precision;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Enumerates catalog contents at a precision, for one catalog layout.
 */
public interface QueryEngine {

    /**
     * @param pattern optional filter, matched anywhere in the symbol; may be null
     */
    Set<String> query(ReferenceCatalog catalog, Precision precision, FunctionalityFilter functionality,
            Pattern pattern);

    static boolean passes(Pattern pattern, String symbol) {
        return pattern == null || pattern.matcher(symbol).find();
    }
}

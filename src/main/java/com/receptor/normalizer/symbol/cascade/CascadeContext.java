package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.catalog.SynonymTable;
import com.receptor.normalizer.parser.ParsedSymbol;
import com.receptor.normalizer.symbol.ValidationOptions;
import com.receptor.normalizer.symbol.ValidityOracle;

/**
 * Call-local state shared by the strategies of one cascade run.
 *
 * @param mayRetry whether a strategy may re-enter the cascade; cleared on re-entry
 */
public record CascadeContext(
        ReferenceCatalog catalog,
        SynonymTable synonyms,
        ValidityOracle oracle,
        ValidationOptions options,
        ResolutionCascade cascade,
        boolean mayRetry) {

    public boolean accepts(ParsedSymbol symbol) {
        return oracle.accepts(symbol, options);
    }

    /**
     * Run the whole cascade once more on a variant, with re-entry disabled.
     */
    public ParsedSymbol retry(ParsedSymbol variant) {
        return cascade.resolve(variant, new CascadeContext(catalog, synonyms, oracle, options, cascade, false));
    }
}

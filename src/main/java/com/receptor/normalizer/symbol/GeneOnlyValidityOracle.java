package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.Objects;
import java.util.Optional;

/**
 * Oracle for catalogs that list genes without allele trees (mouse MH).
 */
public class GeneOnlyValidityOracle implements ValidityOracle {

    private final ReferenceCatalog catalog;

    public GeneOnlyValidityOracle(ReferenceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public boolean accepts(ParsedSymbol symbol, ValidationOptions options) {
        return catalog.containsGene(symbol.getGene());
    }

    @Override
    public Optional<InvalidReason> reasonInvalid(ParsedSymbol symbol, ValidationOptions options) {
        return accepts(symbol, options) ? Optional.empty() : Optional.of(InvalidReason.UNRECOGNIZED_GENE);
    }
}

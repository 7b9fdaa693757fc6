package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.Functionality;
import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.Objects;
import java.util.Optional;

/**
 * Oracle for TR and IG catalogs, whose alleles are a single numbered field
 * carrying a functionality label.
 */
public class ReceptorValidityOracle implements ValidityOracle {

    private final ReferenceCatalog catalog;

    public ReceptorValidityOracle(ReferenceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public boolean accepts(ParsedSymbol symbol, ValidationOptions options) {
        return hasValidName(symbol.getGene(), options);
    }

    public boolean hasValidName(String gene, ValidationOptions options) {
        return catalog.containsGene(gene) || (options.allowSubgroup() && catalog.isSubgroup(gene));
    }

    public boolean isSubgroupOnly(String gene) {
        return !catalog.containsGene(gene) && catalog.isSubgroup(gene);
    }

    @Override
    public Optional<InvalidReason> reasonInvalid(ParsedSymbol symbol, ValidationOptions options) {
        String gene = symbol.getGene();
        if (!catalog.containsGene(gene)) {
            if (catalog.isSubgroup(gene)) {
                return options.allowSubgroup() ? Optional.empty() : Optional.of(InvalidReason.IS_SUBGROUP);
            }
            return Optional.of(InvalidReason.UNRECOGNIZED_GENE);
        }

        if (!symbol.hasAllele()) {
            if (options.enforceFunctional() && !catalog.hasFunctionalAllele(gene)) {
                return Optional.of(InvalidReason.NO_FUNCTIONAL_ALLELES);
            }
            return Optional.empty();
        }

        Optional<Object> leaf = catalog.lookup(gene, symbol.getAlleleFields());
        if (leaf.isEmpty()) {
            return Optional.of(InvalidReason.NONEXISTENT_ALLELE);
        }
        if (options.enforceFunctional()
                && Functionality.fromLabel(leaf.get()).filter(Functionality.FUNCTIONAL::equals).isEmpty()) {
            return Optional.of(InvalidReason.NONFUNCTIONAL_ALLELE);
        }
        return Optional.empty();
    }
}

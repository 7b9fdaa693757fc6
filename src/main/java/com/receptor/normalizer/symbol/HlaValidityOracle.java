package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.parser.ParsedSymbol;
import com.receptor.normalizer.parser.SymbolGrammar;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Oracle for HLA catalogs. Only the first two fields (the protein) are walked
 * in the catalog tree; deeper fields are checked for shape. G and P group
 * designations are walked in full.
 */
public class HlaValidityOracle implements ValidityOracle {

    private static final int PROTEIN_FIELDS = 2;
    private static final int MAX_EXTRA_FIELDS = 2;

    private final ReferenceCatalog catalog;

    public HlaValidityOracle(ReferenceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public boolean accepts(ParsedSymbol symbol, ValidationOptions options) {
        return isValid(symbol, options);
    }

    /**
     * Functionality enforcement does not apply: HLA catalogs carry no labels.
     */
    @Override
    public Optional<InvalidReason> reasonInvalid(ParsedSymbol symbol, ValidationOptions options) {
        String gene = symbol.getGene();
        List<String> fields = symbol.getAlleleFields();

        if (SymbolGrammar.B2M.equals(gene) && fields.isEmpty()) {
            return Optional.empty();
        }
        if (!catalog.containsGene(gene)) {
            return Optional.of(InvalidReason.UNRECOGNIZED_GENE);
        }

        List<String> walked = isGroup(fields) ? fields : fields.subList(0, Math.min(PROTEIN_FIELDS, fields.size()));
        if (catalog.lookup(gene, walked).isEmpty()) {
            return Optional.of(InvalidReason.NONEXISTENT_ALLELE);
        }
        if (isGroup(fields) || fields.size() <= PROTEIN_FIELDS) {
            return Optional.empty();
        }

        List<String> extra = fields.subList(PROTEIN_FIELDS, fields.size());
        if (extra.size() > MAX_EXTRA_FIELDS) {
            return Optional.of(InvalidReason.TOO_MANY_DESIGNATORS);
        }
        for (String field : extra) {
            if (!field.chars().allMatch(Character::isDigit) || field.isEmpty()) {
                return Optional.of(InvalidReason.NON_NUMERICAL_DESIGNATORS);
            }
            if (field.length() < 2) {
                return Optional.of(InvalidReason.NON_TWO_DIGIT_DESIGNATORS);
            }
        }
        return Optional.empty();
    }

    static boolean isGroup(List<String> fields) {
        if (fields.isEmpty()) {
            return false;
        }
        String last = fields.get(fields.size() - 1);
        return last.endsWith("G") || last.endsWith("P");
    }
}

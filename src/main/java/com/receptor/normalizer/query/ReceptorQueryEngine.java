package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.symbol.Precision;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * TR and IG queries. A gene matches a functionality filter when any of its
 * alleles does.
 */
public class ReceptorQueryEngine implements QueryEngine {

    @Override
    public Set<String> query(ReferenceCatalog catalog, Precision precision, FunctionalityFilter functionality,
            Pattern pattern) {
        if (precision != Precision.ALLELE && precision != Precision.GENE) {
            throw new IllegalArgumentException("Unsupported query precision for TR/IG: " + precision);
        }
        Set<String> results = new TreeSet<>();
        for (String gene : catalog.geneNames()) {
            Map<String, Object> alleles = catalog.alleles(gene);
            if (precision == Precision.GENE) {
                boolean anyMatch = alleles.values().stream().anyMatch(functionality::matches);
                if (anyMatch && QueryEngine.passes(pattern, gene)) {
                    results.add(gene);
                }
                continue;
            }
            alleles.forEach((allele, label) -> {
                String symbol = gene + "*" + allele;
                if (functionality.matches(label) && QueryEngine.passes(pattern, symbol)) {
                    results.add(symbol);
                }
            });
        }
        return results;
    }
}

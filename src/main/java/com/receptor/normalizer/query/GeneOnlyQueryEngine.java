package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.symbol.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Queries over gene-only catalogs. Finer precisions fall back to gene names.
 */
public class GeneOnlyQueryEngine implements QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(GeneOnlyQueryEngine.class);

    @Override
    public Set<String> query(ReferenceCatalog catalog, Precision precision, FunctionalityFilter functionality,
            Pattern pattern) {
        if (precision != Precision.GENE) {
            log.warn("Catalog holds genes only; returning genes for precision {}", precision);
        }
        Set<String> results = new TreeSet<>();
        for (String gene : catalog.geneNames()) {
            if (QueryEngine.passes(pattern, gene)) {
                results.add(gene);
            }
        }
        return results;
    }
}

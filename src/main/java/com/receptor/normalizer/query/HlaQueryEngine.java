package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.symbol.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * HLA queries. Allele queries enumerate two-field protein designations and
 * skip G and P groups; functionality filters do not apply.
 */
public class HlaQueryEngine implements QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(HlaQueryEngine.class);

    @Override
    public Set<String> query(ReferenceCatalog catalog, Precision precision, FunctionalityFilter functionality,
            Pattern pattern) {
        if (functionality != FunctionalityFilter.ANY) {
            log.warn("Functionality filter {} is ignored for HLA queries", functionality);
        }
        Set<String> results = new TreeSet<>();
        for (String gene : catalog.geneNames()) {
            if (precision == Precision.GENE || precision == Precision.SUBGROUP) {
                if (QueryEngine.passes(pattern, gene)) {
                    results.add(gene);
                }
                continue;
            }
            for (Map.Entry<String, Object> first : catalog.alleles(gene).entrySet()) {
                if (!(first.getValue() instanceof Map<?, ?> second)) {
                    continue;
                }
                for (Object key : second.keySet()) {
                    String field = String.valueOf(key);
                    if (!field.chars().allMatch(Character::isDigit)) {
                        continue;
                    }
                    String symbol = gene + "*" + first.getKey() + ":" + field;
                    if (QueryEngine.passes(pattern, symbol)) {
                        results.add(symbol);
                    }
                }
            }
        }
        if (precision == Precision.ALLELE) {
            log.warn("HLA allele queries are limited to two-field protein designations");
        }
        return results;
    }
}

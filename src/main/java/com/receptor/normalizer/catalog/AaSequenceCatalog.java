package com.receptor.normalizer.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Allele symbol to region name to amino-acid sequence.
 */
public final class AaSequenceCatalog {

    public static final String V_REGION = "V-REGION";
    public static final String FR3 = "FR3-IMGT";
    public static final String J_REGION = "J-REGION";
    public static final String J_MOTIF = "J-MOTIF";

    private static final AaSequenceCatalog EMPTY = new AaSequenceCatalog(Map.of());

    private final Map<String, Map<String, String>> sequences;

    public AaSequenceCatalog(Map<String, Map<String, String>> sequences) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        sequences.forEach((symbol, regions) ->
                copy.put(symbol, Collections.unmodifiableMap(new LinkedHashMap<>(regions))));
        this.sequences = Collections.unmodifiableMap(copy);
    }

    public static AaSequenceCatalog empty() {
        return EMPTY;
    }

    public Optional<Map<String, String>> regions(String symbol) {
        return Optional.ofNullable(sequences.get(symbol));
    }

    public Set<String> symbols() {
        return sequences.keySet();
    }

    public boolean isEmpty() {
        return sequences.isEmpty();
    }
}

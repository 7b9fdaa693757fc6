package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.CatalogLookupException;
import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.context.FamilyProfile;
import com.receptor.normalizer.context.NormalizerContext;

import java.util.Map;
import java.util.Objects;

/**
 * Exact-key lookups in the amino-acid sequence catalogs.
 */
public class SequenceLookup {

    private final NormalizerContext context;

    public SequenceLookup() {
        this(NormalizerContext.defaultContext());
    }

    public SequenceLookup(NormalizerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * @return region name to amino-acid sequence, for example {@code J-REGION}
     * @throws CatalogLookupException when the species or the symbol is unknown
     */
    public Map<String, String> getAminoAcidSequence(String symbol, GeneFamily family, String species) {
        Objects.requireNonNull(symbol, "symbol");
        FamilyProfile profile = context.profile(species, family)
                .orElseThrow(() -> new CatalogLookupException("Unsupported species for " + family + ": " + species));
        return profile.getSequences().regions(symbol)
                .orElseThrow(() -> new CatalogLookupException(
                        "No amino acid sequence known for " + symbol + " (" + species + ")"));
    }
}

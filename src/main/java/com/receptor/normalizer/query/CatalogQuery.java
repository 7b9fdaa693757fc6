package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.context.FamilyProfile;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.symbol.Precision;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Enumerates the symbols of a catalog, dispatching to the query engine of the
 * (species, family) profile.
 */
public class CatalogQuery {

    private final NormalizerContext context;

    public CatalogQuery() {
        this(NormalizerContext.defaultContext());
    }

    public CatalogQuery(NormalizerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public Set<String> query(GeneFamily family, String species, Precision precision) {
        return query(family, species, precision, FunctionalityFilter.ANY, null);
    }

    /**
     * @param contains optional regular expression a symbol must contain
     * @throws IllegalArgumentException when the species has no catalog for the family
     */
    public Set<String> query(GeneFamily family, String species, Precision precision,
            FunctionalityFilter functionality, String contains) {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(precision, "precision");
        Objects.requireNonNull(functionality, "functionality");
        FamilyProfile profile = context.profile(species, family)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported species for " + family + " queries: " + species));
        Pattern pattern = contains == null ? null : Pattern.compile(contains);
        return Collections.unmodifiableSet(
                profile.getQueryEngine().query(profile.getReference(), precision, functionality, pattern));
    }
}

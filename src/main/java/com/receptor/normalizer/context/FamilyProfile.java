package com.receptor.normalizer.context;

import com.receptor.normalizer.catalog.AaSequenceCatalog;
import com.receptor.normalizer.catalog.CatalogBundle;
import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.catalog.Species;
import com.receptor.normalizer.catalog.SynonymTable;
import com.receptor.normalizer.parser.SymbolGrammar;
import com.receptor.normalizer.query.QueryEngine;
import com.receptor.normalizer.symbol.PrecisionCompiler;
import com.receptor.normalizer.symbol.ValidityOracle;
import com.receptor.normalizer.symbol.cascade.ResolutionCascade;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything the engine needs to standardize symbols of one species and gene
 * family: catalogs, grammar, oracle, correction strategies, compiler, query
 * engine.
 */
@Value
@Builder
public class FamilyProfile {
    @NonNull
    CatalogBundle catalogs;
    @NonNull
    SymbolGrammar grammar;
    @NonNull
    ValidityOracle oracle;
    @NonNull
    ResolutionCascade cascade;
    @NonNull
    PrecisionCompiler compiler;
    @NonNull
    QueryEngine queryEngine;
    /** Locate V anchors by the trailing Y?C motif when FR3 does not end in a cysteine. */
    boolean motifAnchorFallback;

    public Species getSpecies() {
        return catalogs.getSpecies();
    }

    public GeneFamily getFamily() {
        return catalogs.getFamily();
    }

    public ReferenceCatalog getReference() {
        return catalogs.getReference();
    }

    public SynonymTable getSynonyms() {
        return catalogs.getSynonyms();
    }

    public AaSequenceCatalog getSequences() {
        return catalogs.getSequences();
    }
}

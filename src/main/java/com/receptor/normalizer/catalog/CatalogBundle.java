package com.receptor.normalizer.catalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The three lookup structures loaded for one (species, family) pair.
 */
@Value
@Builder
public class CatalogBundle {
    @NonNull
    Species species;
    @NonNull
    GeneFamily family;
    @NonNull
    ReferenceCatalog reference;
    @NonNull
    @Builder.Default
    SynonymTable synonyms = SynonymTable.empty();
    @NonNull
    @Builder.Default
    AaSequenceCatalog sequences = AaSequenceCatalog.empty();
}

package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.Species;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Arguments of one symbol standardization.
 */
@Value
@Builder(toBuilder = true)
public class SymbolRequest {
    @NonNull
    String symbol;
    @NonNull
    @Builder.Default
    GeneFamily family = GeneFamily.TR;
    @NonNull
    @Builder.Default
    String species = Species.HOMO_SAPIENS.getKey();
    boolean enforceFunctional;
    boolean allowSubgroup;
    /** Requested precision; null reports the highest precision reached. */
    Precision precision;
}

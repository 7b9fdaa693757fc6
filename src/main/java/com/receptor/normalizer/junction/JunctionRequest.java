package com.receptor.normalizer.junction;

import com.receptor.normalizer.catalog.Species;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Arguments of one junction standardization. Without a locus the sequence is
 * only checked against the junction pattern and wrapped when needed.
 */
@Value
@Builder(toBuilder = true)
public class JunctionRequest {
    @NonNull
    String sequence;
    Locus locus;
    String vSymbol;
    String jSymbol;
    @NonNull
    @Builder.Default
    String species = Species.HOMO_SAPIENS.getKey();
    @NonNull
    @Builder.Default
    JunctionSettings settings = JunctionSettings.defaults();
    /** Pattern-only mode: reject instead of wrapping. */
    boolean strict;
}

package com.receptor.normalizer.junction;

import lombok.Builder;
import lombok.Value;

/**
 * Alignment and correction parameters of the junction standardizer.
 */
@Value
@Builder(toBuilder = true)
public class JunctionSettings {

    @Builder.Default
    boolean enforceFunctionalV = true;
    @Builder.Default
    boolean enforceFunctionalJ = false;

    /** Replace a non-cysteine first residue when that improves the V alignment. */
    boolean allowCCorrection;
    /** Replace a non F/W last residue when that improves the J alignment. */
    boolean allowFwCorrection;
    /** Allow prepending more than the conserved cysteine. */
    boolean allowVReconstruction;
    /** Allow appending more than the conserved F/W. */
    boolean allowJReconstruction;

    @Builder.Default
    double mismatchPenalty = 1.5;
    @Builder.Default
    int maxJMismatches = 1;
    @Builder.Default
    int maxVMismatches = 2;
    @Builder.Default
    int minJScore = 3;
    @Builder.Default
    int minVScore = 2;
    @Builder.Default
    int minJunctionLength = 4;

    @Builder.Default
    boolean logFailures = true;

    public static JunctionSettings defaults() {
        return JunctionSettings.builder().build();
    }
}

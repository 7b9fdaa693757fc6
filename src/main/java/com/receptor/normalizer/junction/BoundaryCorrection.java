package com.receptor.normalizer.junction;

/**
 * Sequence implied by one alignment.
 *
 * @param change residues added at the corrected end; negative when trimmed, zero when untouched
 */
public record BoundaryCorrection(String sequence, int change) {

    public boolean isUnchanged() {
        return change == 0;
    }

    public boolean isSingleResidueExtension() {
        return change == 1;
    }

    public boolean isReconstruction() {
        return change > 1;
    }
}

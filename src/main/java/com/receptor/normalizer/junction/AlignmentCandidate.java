package com.receptor.normalizer.junction;

/**
 * Best alignment of a sequence against one reference region.
 *
 * @param offset for J regions, the sequence position of the region start; for
 *               V regions, the region position aligned with the sequence start
 */
public record AlignmentCandidate(ReferenceRegion region, int offset, double score) {

    public String label() {
        return region.label();
    }

    public int anchorIndex() {
        return region.anchor();
    }
}

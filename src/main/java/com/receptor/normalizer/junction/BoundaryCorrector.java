package com.receptor.normalizer.junction;

import java.util.List;
import java.util.Optional;

/**
 * Turns alignments into boundary corrections and settles on one of them.
 */
public class BoundaryCorrector {

    /** Chosen sequence, or the failure reason. */
    public record Outcome(String sequence, String error) {

        static Outcome accepted(String sequence) {
            return new Outcome(sequence, null);
        }

        static Outcome failed(String sequence, String error) {
            return new Outcome(sequence, error);
        }

        public Optional<String> getError() {
            return Optional.ofNullable(error);
        }
    }

    static BoundaryCorrection correctJ(String sequence, AlignmentCandidate alignment) {
        int implied = alignment.offset() + alignment.anchorIndex() + 1;
        int length = sequence.length();
        if (implied == length) {
            return new BoundaryCorrection(sequence, 0);
        }
        if (implied < length) {
            return new BoundaryCorrection(sequence.substring(0, implied), implied - length);
        }
        String extension = alignment.region().sequence().substring(length - alignment.offset(),
                alignment.anchorIndex() + 1);
        return new BoundaryCorrection(sequence + extension, implied - length);
    }

    static BoundaryCorrection correctV(String sequence, AlignmentCandidate alignment) {
        int offset = alignment.offset();
        int anchor = alignment.anchorIndex();
        if (offset == anchor) {
            return new BoundaryCorrection(sequence, 0);
        }
        if (offset < anchor) {
            return new BoundaryCorrection(sequence.substring(anchor - offset), offset - anchor);
        }
        return new BoundaryCorrection(alignment.region().sequence().substring(anchor, offset) + sequence,
                offset - anchor);
    }

    public Outcome chooseJ(String sequence, List<AlignmentCandidate> alignments, boolean allowReconstruction,
            boolean symbolGiven) {
        List<BoundaryCorrection> corrections = alignments.stream().map(a -> correctJ(sequence, a)).toList();
        if (corrections.stream().anyMatch(BoundaryCorrection::isUnchanged)) {
            return Outcome.accepted(sequence);
        }
        List<BoundaryCorrection> options = preferSingleResidue(corrections, allowReconstruction);
        if (options.stream().noneMatch(BoundaryCorrection::isSingleResidueExtension) && !symbolGiven) {
            options = options.stream().filter(c -> c.sequence().endsWith("F") || c.sequence().endsWith("W")).toList();
        }
        return settle(sequence, options, "J");
    }

    public Outcome chooseV(String sequence, List<AlignmentCandidate> alignments, boolean allowReconstruction) {
        List<BoundaryCorrection> corrections = alignments.stream().map(a -> correctV(sequence, a)).toList();
        if (corrections.stream().anyMatch(BoundaryCorrection::isUnchanged)) {
            return Outcome.accepted(sequence);
        }
        List<BoundaryCorrection> options = preferSingleResidue(corrections, allowReconstruction).stream()
                .filter(c -> c.sequence().startsWith("C"))
                .toList();
        return settle(sequence, options, "V");
    }

    private static List<BoundaryCorrection> preferSingleResidue(List<BoundaryCorrection> corrections,
            boolean allowReconstruction) {
        List<BoundaryCorrection> permitted = corrections.stream()
                .filter(c -> allowReconstruction || !c.isReconstruction())
                .toList();
        List<BoundaryCorrection> single = permitted.stream()
                .filter(BoundaryCorrection::isSingleResidueExtension)
                .toList();
        return single.isEmpty() ? permitted : single;
    }

    private static Outcome settle(String sequence, List<BoundaryCorrection> options, String side) {
        List<String> distinct = options.stream().map(BoundaryCorrection::sequence).distinct().toList();
        if (distinct.size() == 1) {
            return Outcome.accepted(distinct.get(0));
        }
        if (distinct.isEmpty()) {
            return Outcome.failed(sequence, side + " side reconstruction unsuccessful");
        }
        return Outcome.failed(sequence, side + " side reconstruction ambiguous");
    }
}

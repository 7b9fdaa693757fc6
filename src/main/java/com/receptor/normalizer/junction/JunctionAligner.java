package com.receptor.normalizer.junction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ungapped alignment of junction candidates against reference regions.
 * <p>
 * J regions are slid along the sequence end, anchored on the conserved F/W; V
 * regions are slid along the sequence start, anchored on the conserved
 * cysteine. An offset is only considered when the sequence agrees with the
 * region from the anchor outwards, or when the anchor falls outside the
 * sequence.
 */
public class JunctionAligner {

    private final JunctionSettings settings;

    public JunctionAligner(JunctionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * @return the highest scoring J alignments, ties included; empty when none reaches the minimum score
     */
    public List<AlignmentCandidate> alignJ(String sequence, List<ReferenceRegion> regions) {
        List<AlignmentCandidate> candidates = new ArrayList<>();
        for (ReferenceRegion region : regions) {
            alignJ(sequence, region).ifPresent(candidates::add);
        }
        return best(candidates, settings.getMinJScore());
    }

    public List<AlignmentCandidate> alignV(String sequence, List<ReferenceRegion> regions) {
        List<AlignmentCandidate> candidates = new ArrayList<>();
        for (ReferenceRegion region : regions) {
            alignV(sequence, region).ifPresent(candidates::add);
        }
        return best(candidates, settings.getMinVScore());
    }

    Optional<AlignmentCandidate> alignJ(String sequence, ReferenceRegion region) {
        String ref = region.sequence();
        AlignmentCandidate best = null;
        for (int offset = sequence.length() - ref.length(); offset < sequence.length(); offset++) {
            if (!isValidJAnchor(sequence, region, offset)) {
                continue;
            }
            double score = scoreJ(sequence, ref, offset);
            if (score != AlignmentScorer.NO_ALIGNMENT && (best == null || score > best.score())) {
                best = new AlignmentCandidate(region, offset, score);
            }
        }
        return Optional.ofNullable(best);
    }

    Optional<AlignmentCandidate> alignV(String sequence, ReferenceRegion region) {
        String ref = region.sequence();
        int lowest = Math.max(0, region.anchor() - sequence.length() + 1);
        AlignmentCandidate best = null;
        for (int offset = ref.length() - 1; offset >= lowest; offset--) {
            if (!isValidVAnchor(sequence, region, offset)) {
                continue;
            }
            double score = scoreV(sequence, ref, offset);
            if (score != AlignmentScorer.NO_ALIGNMENT && (best == null || score > best.score())) {
                best = new AlignmentCandidate(region, offset, score);
            }
        }
        return Optional.ofNullable(best);
    }

    static boolean isValidJAnchor(String sequence, ReferenceRegion region, int offset) {
        int anchorPosition = offset + region.anchor();
        if (anchorPosition < 0) {
            return false;
        }
        if (anchorPosition >= sequence.length()) {
            return true;
        }
        String tail = sequence.substring(anchorPosition);
        String ref = region.sequence();
        int end = region.anchor() + tail.length();
        return end <= ref.length() && tail.equals(ref.substring(region.anchor(), end));
    }

    static boolean isValidVAnchor(String sequence, ReferenceRegion region, int offset) {
        if (offset > region.anchor()) {
            return true;
        }
        int headLength = region.anchor() - offset + 1;
        return headLength <= sequence.length()
                && sequence.substring(0, headLength).equals(region.sequence().substring(offset, region.anchor() + 1));
    }

    double scoreJ(String sequence, String ref, int offset) {
        int sequenceStart = Math.max(offset, 0);
        int refStart = Math.max(-offset, 0);
        int length = Math.min(sequence.length() - sequenceStart, ref.length() - refStart);
        if (length <= 0) {
            return AlignmentScorer.NO_ALIGNMENT;
        }
        boolean[] matches = new boolean[length];
        for (int i = 0; i < length; i++) {
            matches[i] = sequence.charAt(sequenceStart + i) == ref.charAt(refStart + i);
        }
        return AlignmentScorer.score(matches, settings.getMismatchPenalty(), settings.getMaxJMismatches());
    }

    double scoreV(String sequence, String ref, int offset) {
        int length = Math.min(ref.length() - offset, sequence.length());
        if (length <= 0) {
            return AlignmentScorer.NO_ALIGNMENT;
        }
        // reversed, so the free end is the one away from the cysteine
        boolean[] matches = new boolean[length];
        for (int i = 0; i < length; i++) {
            matches[length - 1 - i] = sequence.charAt(i) == ref.charAt(offset + i);
        }
        return AlignmentScorer.score(matches, settings.getMismatchPenalty(), settings.getMaxVMismatches());
    }

    private static List<AlignmentCandidate> best(List<AlignmentCandidate> candidates, int minScore) {
        double bestScore = minScore;
        List<AlignmentCandidate> best = new ArrayList<>();
        for (AlignmentCandidate candidate : candidates) {
            if (candidate.score() > bestScore) {
                bestScore = candidate.score();
                best.clear();
                best.add(candidate);
            } else if (candidate.score() == bestScore) {
                best.add(candidate);
            }
        }
        return best;
    }
}

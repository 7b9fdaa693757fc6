package com.receptor.normalizer.junction;

import lombok.experimental.UtilityClass;

/**
 * Scores ungapped alignments. Matches count one, mismatches cost the penalty.
 * The match array runs from the unanchored end towards the anchor, so leading
 * mismatches are free and excess mismatches are shed from that end.
 */
@UtilityClass
public class AlignmentScorer {

    public static final double NO_ALIGNMENT = -1;

    public static double score(boolean[] matches, double mismatchPenalty, int maxMismatches) {
        int start = nextMatch(matches, 0);
        if (start < 0) {
            return NO_ALIGNMENT;
        }
        while (mismatchesFrom(matches, start) > maxMismatches) {
            int firstMismatch = nextMismatch(matches, start);
            start = nextMatch(matches, firstMismatch + 1);
            if (start < 0) {
                return NO_ALIGNMENT;
            }
        }
        double score = 0;
        for (int i = start; i < matches.length; i++) {
            score += matches[i] ? 1 : -mismatchPenalty;
        }
        return score < 0 ? NO_ALIGNMENT : score;
    }

    private static int nextMatch(boolean[] matches, int from) {
        for (int i = from; i < matches.length; i++) {
            if (matches[i]) {
                return i;
            }
        }
        return -1;
    }

    private static int nextMismatch(boolean[] matches, int from) {
        for (int i = from; i < matches.length; i++) {
            if (!matches[i]) {
                return i;
            }
        }
        return matches.length;
    }

    private static int mismatchesFrom(boolean[] matches, int from) {
        int count = 0;
        for (int i = from; i < matches.length; i++) {
            if (!matches[i]) {
                count++;
            }
        }
        return count;
    }
}

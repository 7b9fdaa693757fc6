package com.receptor.normalizer.junction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AlignmentScorerTest {

    private static boolean[] matches(String pattern) {
        boolean[] result = new boolean[pattern.length()];
        for (int i = 0; i < pattern.length(); i++) {
            result[i] = pattern.charAt(i) == '+';
        }
        return result;
    }

    @Test
    void testPerfectMatch() {
        assertThat(AlignmentScorer.score(matches("+++++"), 1.5, 1)).isEqualTo(5.0);
    }

    @Test
    void testLeadingMismatchesAreFree() {
        assertThat(AlignmentScorer.score(matches("-+++"), 1.5, 1)).isEqualTo(3.0);
    }

    @Test
    void testMismatchPenalty() {
        assertThat(AlignmentScorer.score(matches("+-+++"), 1.5, 1)).isEqualTo(2.5);
    }

    @Test
    void testExcessMismatchesAreShedFromTheFreeEnd() {
        assertThat(AlignmentScorer.score(matches("+-+-++"), 1.5, 1)).isEqualTo(1.5);
    }

    @Test
    void testNoMatch() {
        assertThat(AlignmentScorer.score(matches("---"), 1.5, 2)).isEqualTo(AlignmentScorer.NO_ALIGNMENT);
        assertThat(AlignmentScorer.score(new boolean[0], 1.5, 2)).isEqualTo(AlignmentScorer.NO_ALIGNMENT);
    }

    @Test
    void testNegativeScoreIsNoAlignment() {
        assertThat(AlignmentScorer.score(matches("+--"), 1.5, 2)).isEqualTo(AlignmentScorer.NO_ALIGNMENT);
    }
}

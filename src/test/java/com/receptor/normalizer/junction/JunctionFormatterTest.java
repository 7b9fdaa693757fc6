package com.receptor.normalizer.junction;

import com.receptor.normalizer.model.JunctionResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JunctionFormatterTest {

    private final JunctionFormatter formatter = new JunctionFormatter();

    @Test
    void testWellFormedJunction() {
        assertThat(formatter.format("caslf", "CASLF", false).getJunction()).contains("CASLF");
        assertThat(formatter.format("CASLW", "CASLW", true).getJunction()).contains("CASLW");
    }

    @Test
    void testWrapsMissingBoundaries() {
        JunctionResult result = formatter.format("sadaf", "SADAF", false);

        assertThat(result.getJunction()).contains("CSADAFF");
        assertThat(result.getCdr3()).contains("SADAF");
    }

    @Test
    void testStrictRejects() {
        JunctionResult result = formatter.format("sadaf", "SADAF", true);

        assertThat(result.getError()).contains("not a valid junction");
        assertThat(result.getAttemptedFix()).contains("SADAF");
    }
}

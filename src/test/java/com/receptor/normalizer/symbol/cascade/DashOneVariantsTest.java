package com.receptor.normalizer.symbol.cascade;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DashOneVariantsTest {

    @Test
    void testToggledAddsSuffix() {
        assertThat(DashOneVariants.toggled("TRBV6")).containsExactly("TRBV6-1");
    }

    @Test
    void testToggledRemovesSuffix() {
        assertThat(DashOneVariants.toggled("TRBV20-1")).containsExactly("TRBV20");
    }

    @Test
    void testToggledCoversEveryToken() {
        assertThat(DashOneVariants.toggled("TRAV15-1/DV6-1"))
                .containsExactly("TRAV15-1/DV6", "TRAV15/DV6-1", "TRAV15/DV6");
    }

    @Test
    void testOtherGeneNumbersAreLeftAlone() {
        assertThat(DashOneVariants.toggled("TRBV6-4")).isEmpty();
        assertThat(DashOneVariants.toggled("TRBJ")).isEmpty();
    }

    @Test
    void testRemovedOnlyDropsExistingSuffix() {
        assertThat(DashOneVariants.removed("TRBV20-1")).containsExactly("TRBV20");
        assertThat(DashOneVariants.removed("TRBV6")).isEmpty();
        assertThat(DashOneVariants.removed("IGKV1-9-1")).isEmpty();
    }
}

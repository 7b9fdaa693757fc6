package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.AaSequenceCatalog;
import com.receptor.normalizer.catalog.CatalogLookupException;
import com.receptor.normalizer.catalog.GeneFamily;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SequenceLookupTest {

    private final SequenceLookup lookup = new SequenceLookup();

    @Test
    void testJoiningRegion() {
        Map<String, String> regions = lookup.getAminoAcidSequence("TRBJ2-7*01", GeneFamily.TR, "homosapiens");

        assertThat(regions).containsEntry(AaSequenceCatalog.J_REGION, "SYEQYFGPGTRLTVT")
                .containsEntry(AaSequenceCatalog.J_MOTIF, "FGPG");
    }

    @Test
    void testVariableRegionContainsFramework() {
        Map<String, String> regions = lookup.getAminoAcidSequence("TRBV6-4*01", GeneFamily.TR, "homosapiens");

        assertThat(regions.get(AaSequenceCatalog.V_REGION)).contains(regions.get(AaSequenceCatalog.FR3));
    }

    @Test
    void testLookupNeedsExactKey() {
        assertThatThrownBy(() -> lookup.getAminoAcidSequence("TRBJ2-7", GeneFamily.TR, "homosapiens"))
                .isInstanceOf(CatalogLookupException.class)
                .hasMessageContaining("TRBJ2-7");
    }

    @Test
    void testUnsupportedSpecies() {
        assertThatThrownBy(() -> lookup.getAminoAcidSequence("TRBJ2-7*01", GeneFamily.TR, "dog"))
                .isInstanceOf(CatalogLookupException.class)
                .hasMessageContaining("dog");
    }

    @Test
    void testFamilyWithoutSequences() {
        assertThatThrownBy(() -> lookup.getAminoAcidSequence("HLA-A", GeneFamily.MH, "homosapiens"))
                .isInstanceOf(CatalogLookupException.class);
    }
}

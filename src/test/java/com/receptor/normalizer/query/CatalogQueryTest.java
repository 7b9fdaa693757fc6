package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.symbol.Precision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class CatalogQueryTest {

    private final CatalogQuery query = new CatalogQuery();

    @Test
    void testAllHumanTrGenes() {
        Set<String> genes = query.query(GeneFamily.TR, "homosapiens", Precision.GENE);

        assertThat(genes).hasSize(46).contains("TRAV1-1", "TRBV20/OR9-2", "TRBJ2-7");
        assertThat(List.copyOf(genes)).isSorted();
    }

    @Test
    void testNonfunctionalGenesWithPattern() {
        Set<String> genes = query.query(GeneFamily.TR, "homosapiens", Precision.GENE, FunctionalityFilter.NF, "TRBV");

        assertThat(genes).containsExactly("TRBV1", "TRBV12-1", "TRBV20/OR9-2", "TRBV24/OR9-2");
    }

    @Test
    void testPseudogenes() {
        Set<String> genes = query.query(GeneFamily.TR, "homosapiens", Precision.GENE, FunctionalityFilter.P, null);

        assertThat(genes).containsExactly("TRAV35", "TRAV8-7", "TRBV1", "TRBV12-1", "TRBV24/OR9-2");
    }

    @Test
    void testOrfAlleles() {
        Set<String> alleles = query.query(GeneFamily.TR, "homosapiens", Precision.ALLELE, FunctionalityFilter.ORF,
                null);

        assertThat(alleles).containsExactly("TRAJ1*01", "TRBJ2-7*02", "TRBV20/OR9-2*01", "TRBV20/OR9-2*02",
                "TRBV20/OR9-2*03");
    }

    @Test
    void testAllelePattern() {
        Set<String> alleles = query.query(GeneFamily.TR, "homosapiens", Precision.ALLELE, FunctionalityFilter.ANY,
                "TRBJ2");

        assertThat(alleles).containsExactly("TRBJ2-1*01", "TRBJ2-7*01", "TRBJ2-7*02");
    }

    @Test
    void testAlphaDeltaGenes() {
        Set<String> genes = query.query(GeneFamily.TR, "homosapiens", Precision.GENE, FunctionalityFilter.ANY, "DV");

        assertThat(genes).containsExactly("TRAV14/DV4", "TRAV29/DV5", "TRAV36/DV7", "TRAV38-2/DV8", "TRDV1",
                "TRDV2");
    }

    @Test
    void testSubgroupQueriesAreRejectedForReceptors() {
        assertThatThrownBy(() -> query.query(GeneFamily.TR, "homosapiens", Precision.SUBGROUP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testImmunoglobulinGenes() {
        Set<String> genes = query.query(GeneFamily.IG, "homosapiens", Precision.GENE, FunctionalityFilter.ANY,
                "^IGKV");

        assertThat(genes).containsExactly("IGKV1-9", "IGKV1/OR2-108", "IGKV3-15", "IGKV6D-21");
    }

    @Test
    void testHlaGenes() {
        assertThat(query.query(GeneFamily.MH, "homosapiens", Precision.GENE)).containsExactly("HLA-A", "HLA-B",
                "HLA-C", "HLA-DPA1", "HLA-DPB1", "HLA-DQA1", "HLA-DQB1", "HLA-DRA", "HLA-DRB1", "HLA-DRB3", "HLA-E",
                "HLA-TAP1");
    }

    @Test
    void testHlaProteinsSkipGroups() {
        Set<String> proteins = query.query(GeneFamily.MH, "homosapiens", Precision.ALLELE, FunctionalityFilter.F,
                "HLA-A\\*");

        assertThat(proteins).containsExactly("HLA-A*01:01", "HLA-A*01:02", "HLA-A*02:01", "HLA-A*02:06");
    }

    @ParameterizedTest
    @EnumSource(value = Precision.class, names = { "GENE", "ALLELE" })
    void testMouseMhReturnsGenes(Precision precision) {
        assertThat(query.query(GeneFamily.MH, "musmusculus", precision)).containsExactly("MH1-M5", "MH1-Q1",
                "MH1-Q10", "MH1-T23", "MH2-AA", "MH2-AB1", "MH2-EA", "MH2-EB1");
    }

    @Test
    void testUnsupportedSpecies() {
        assertThatThrownBy(() -> query.query(GeneFamily.TR, "dog", Precision.GENE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dog");
    }

    @Test
    void testResultIsUnmodifiable() {
        Set<String> genes = query.query(GeneFamily.TR, "homosapiens", Precision.GENE);

        assertThatThrownBy(() -> genes.add("TRBV99")).isInstanceOf(UnsupportedOperationException.class);
    }
}

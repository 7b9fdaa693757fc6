package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.model.StandardizationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class IgSymbolStandardizerTest {

    private final SymbolStandardizer standardizer = new SymbolStandardizer();

    @ParameterizedTest
    @CsvSource({
            "IGHV1-18*01, IGHV1-18*01",
            "ighv1-18*1, IGHV1-18*01",
            "IGHV1.18, IGHV1-18",
            "HV1-18, IGHV1-18",
            "IGHV1-OR15-1, IGHV1/OR15-1",
            "IGHV1OR15-1, IGHV1/OR15-1",
            "IGHD1/OR15-1A, IGHD1/OR15-1a",
            "IGHD1-OR15-1B, IGHD1/OR15-1b",
            "A10, IGKV6D-21",
            "IGO1, IGKV1/OR2-108",
            "L12, IGKV1-9",
            "IGLV(VI)-22-1, IGLV(VI)-22-1"
    })
    void testResolvedSymbols(String input, String expected) {
        StandardizationResult result = standardizer.standardize(input, GeneFamily.IG, "homosapiens");

        assertThat(result.getError()).isEmpty();
        assertThat(result.getHighestPrecision()).contains(expected);
    }

    @Test
    void testUnknownDashOneSuffixIsNotInvented() {
        StandardizationResult result = standardizer.standardize("IGKV1-9-1", GeneFamily.IG, "homosapiens");

        assertThat(result.getError()).contains("unrecognized gene name");
        assertThat(result.getAttemptedFix()).contains("IGKV1-9-1");
    }

    @Test
    void testEnforceFunctional() {
        assertThat(standardizer.standardize("IGLV7-35", GeneFamily.IG, "homosapiens", true, false).getError())
                .contains("gene has no functional alleles");
        assertThat(standardizer.standardize("IGHV6-1*03", GeneFamily.IG, "homosapiens", true, false).getError())
                .contains("nonfunctional allele");
    }

    @Test
    void testGenePrecision() {
        StandardizationResult result = standardizer.standardize(SymbolRequest.builder()
                .symbol("IGHV1-18*01")
                .family(GeneFamily.IG)
                .precision(Precision.GENE)
                .build());

        assertThat(result.getHighestPrecision()).contains("IGHV1-18");
        assertThat(result.getAllele()).isEmpty();
    }

    @Test
    void testMouseImmunoglobulin() {
        assertThat(standardizer.standardize("IGHV1-2", GeneFamily.IG, "musmusculus").getHighestPrecision())
                .contains("IGHV1-2");
    }
}

package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.context.FamilyProfile;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.model.StandardizationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SymbolStandardizerTest {

    private final NormalizerContext context = NormalizerContext.defaultContext();
    private final SymbolStandardizer standardizer = new SymbolStandardizer(context);

    @ParameterizedTest
    @EnumSource(GeneFamily.class)
    void testCatalogNamesAreFixedPoints(GeneFamily family) {
        List<String> mismatches = new ArrayList<>();
        for (FamilyProfile profile : context.profiles(family)) {
            String species = profile.getSpecies().getKey();
            ReferenceCatalog reference = profile.getReference();
            for (String gene : reference.geneNames()) {
                List<String> names = new ArrayList<>();
                names.add(gene);
                if (family == GeneFamily.MH) {
                    addDesignations(gene + "*", reference.alleles(gene), names);
                } else {
                    reference.alleles(gene).keySet().forEach(allele -> names.add(gene + "*" + allele));
                }
                for (String name : names) {
                    StandardizationResult result = standardizer.standardize(name, family, species);
                    if (!result.getHighestPrecision().filter(name::equals).isPresent()) {
                        mismatches.add(species + " " + name + " -> " + result);
                    }
                }
            }
        }

        assertThat(mismatches).isEmpty();
    }

    private static void addDesignations(String prefix, Map<?, ?> node, List<String> names) {
        for (Map.Entry<?, ?> entry : node.entrySet()) {
            String name = prefix + entry.getKey();
            names.add(name);
            if (entry.getValue() instanceof Map<?, ?> child) {
                addDesignations(name + ":", child, names);
            }
        }
    }

    @Test
    void testStandardizingTwiceIsStable() {
        for (String input : List.of("aj1", "TCRBV13S5", "trbv2*1", "TRAV29DV5*01", "TRBV 20-1")) {
            String once = standardizer.standardize(input, GeneFamily.TR, "homosapiens").getHighestPrecision()
                    .orElseThrow();
            String twice = standardizer.standardize(once, GeneFamily.TR, "homosapiens").getHighestPrecision()
                    .orElseThrow();
            assertThat(twice).as(input).isEqualTo(once);
        }
    }

    @Test
    void testPrecisionNeverExceedsRequest() {
        String[] symbols = { "TRBV20-1*01", "TRAV1-1", "TRBV6" };
        for (String symbol : symbols) {
            for (Precision precision : PrecisionCompiler.RECEPTOR.supportedPrecisions()) {
                StandardizationResult result = standardizer.standardize(SymbolRequest.builder()
                        .symbol(symbol)
                        .precision(precision)
                        .build());
                assertThat(result.isSuccess()).as(symbol + " at " + precision).isTrue();
                if (precision.compareTo(Precision.ALLELE) < 0) {
                    assertThat(result.getAllele()).isEmpty();
                }
                if (precision == Precision.SUBGROUP) {
                    assertThat(result.getGene()).isEmpty();
                }
            }
        }
    }

    @Test
    void testSubgroupPrecision() {
        StandardizationResult result = standardizer.standardize(SymbolRequest.builder()
                .symbol("TRBV6-1*01")
                .precision(Precision.SUBGROUP)
                .build());

        assertThat(result.getHighestPrecision()).contains("TRBV6");
    }

    @Test
    void testNullSymbolIsRejected() {
        assertThatThrownBy(() -> standardizer.standardize(null, GeneFamily.TR, "homosapiens"))
                .isInstanceOf(NullPointerException.class);
    }
}

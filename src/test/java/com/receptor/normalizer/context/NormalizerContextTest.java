package com.receptor.normalizer.context;

import com.receptor.normalizer.catalog.CatalogLoadException;
import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.Species;
import com.receptor.normalizer.model.StandardizationResult;
import com.receptor.normalizer.symbol.SymbolStandardizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class NormalizerContextTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultContextIsShared() {
        assertThat(NormalizerContext.defaultContext()).isSameAs(NormalizerContext.defaultContext());
    }

    @Test
    void testProfilesInSpeciesOrder() {
        NormalizerContext context = NormalizerContext.defaultContext();

        assertThat(context.profiles(GeneFamily.TR))
                .extracting(FamilyProfile::getSpecies)
                .containsExactly(Species.HOMO_SAPIENS, Species.MUS_MUSCULUS);
        assertThat(context.profile("Homo sapiens", GeneFamily.MH)).isPresent();
        assertThat(context.profile("dog", GeneFamily.MH)).isEmpty();
    }

    @Test
    void testProfileWiring() {
        NormalizerContext context = NormalizerContext.defaultContext();

        FamilyProfile humanTr = context.profile(Species.HOMO_SAPIENS, GeneFamily.TR).orElseThrow();
        FamilyProfile mouseTr = context.profile(Species.MUS_MUSCULUS, GeneFamily.TR).orElseThrow();

        assertThat(humanTr.getCascade().strategyNames()).endsWith("suffix-toggle");
        assertThat(humanTr.isMotifAnchorFallback()).isFalse();
        assertThat(mouseTr.getSequences().isEmpty()).isFalse();
    }

    @Test
    void testCustomCatalogDirectory() throws IOException {
        Files.writeString(tempDir.resolve("homosapiens_tr.json"), "{\"TRBV99\": {\"01\": \"F\"}}");
        NormalizerConfig config = NormalizerConfig.builder()
                .catalogDir(tempDir)
                .logFailures(false)
                .build();

        NormalizerContext context = NormalizerContext.create(config);
        SymbolStandardizer standardizer = new SymbolStandardizer(context);
        StandardizationResult known = standardizer.standardize("trbv99*1", GeneFamily.TR, "homosapiens");
        StandardizationResult missing = standardizer.standardize("TRBV2", GeneFamily.TR, "homosapiens");

        assertThat(known.getHighestPrecision()).contains("TRBV99*01");
        assertThat(missing.getError()).contains("unrecognized gene name");
        assertThat(context.profile(Species.HOMO_SAPIENS, GeneFamily.IG)).isEmpty();
        assertThat(context.getConfig().isLogFailures()).isFalse();
    }

    @Test
    void testBrokenCatalogDirectory() throws IOException {
        Files.writeString(tempDir.resolve("homosapiens_tr.json"), "[]");
        NormalizerConfig config = NormalizerConfig.builder().catalogDir(tempDir).build();

        assertThatThrownBy(() -> NormalizerContext.create(config)).isInstanceOf(CatalogLoadException.class);
    }
}

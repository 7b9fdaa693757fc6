package com.receptor.normalizer.context;

import com.receptor.normalizer.catalog.CatalogBundle;
import com.receptor.normalizer.catalog.Species;
import com.receptor.normalizer.parser.SymbolGrammar;
import com.receptor.normalizer.query.GeneOnlyQueryEngine;
import com.receptor.normalizer.query.HlaQueryEngine;
import com.receptor.normalizer.query.ReceptorQueryEngine;
import com.receptor.normalizer.symbol.GeneOnlyValidityOracle;
import com.receptor.normalizer.symbol.HlaValidityOracle;
import com.receptor.normalizer.symbol.PrecisionCompiler;
import com.receptor.normalizer.symbol.ReceptorValidityOracle;
import com.receptor.normalizer.symbol.cascade.AlphaDeltaCrossReference;
import com.receptor.normalizer.symbol.cascade.ForgottenAsterisk;
import com.receptor.normalizer.symbol.cascade.ForgottenColon;
import com.receptor.normalizer.symbol.cascade.HlaPrefixRepair;
import com.receptor.normalizer.symbol.cascade.LeadingZeroSearch;
import com.receptor.normalizer.symbol.cascade.NameRepairStrategy;
import com.receptor.normalizer.symbol.cascade.PrefixInsertion;
import com.receptor.normalizer.symbol.cascade.ResolutionCascade;
import com.receptor.normalizer.symbol.cascade.SuffixRemoval;
import com.receptor.normalizer.symbol.cascade.SuffixToggle;
import com.receptor.normalizer.symbol.cascade.SynonymSubstitution;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Dispatch table from a loaded catalog bundle to its family profile.
 */
@UtilityClass
public class FamilyProfiles {

    public static FamilyProfile forBundle(CatalogBundle bundle) {
        return switch (bundle.getFamily()) {
            case TR -> tr(bundle);
            case IG -> ig(bundle);
            case MH -> bundle.getSpecies() == Species.HOMO_SAPIENS ? hla(bundle) : geneOnlyMh(bundle);
        };
    }

    private static FamilyProfile tr(CatalogBundle bundle) {
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                new SynonymSubstitution(false),
                new NameRepairStrategy(NameRepairStrategy.TR_REWRITES),
                new PrefixInsertion("TR"),
                new AlphaDeltaCrossReference(AlphaDeltaCrossReference.Direction.FROM_ALPHA),
                new AlphaDeltaCrossReference(AlphaDeltaCrossReference.Direction.FROM_DELTA),
                new SuffixToggle()));
        return FamilyProfile.builder()
                .catalogs(bundle)
                .grammar(SymbolGrammar.RECEPTOR)
                .oracle(new ReceptorValidityOracle(bundle.getReference()))
                .cascade(cascade)
                .compiler(PrecisionCompiler.RECEPTOR)
                .queryEngine(new ReceptorQueryEngine())
                .motifAnchorFallback(false)
                .build();
    }

    private static FamilyProfile ig(CatalogBundle bundle) {
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                new SynonymSubstitution(false),
                new NameRepairStrategy(NameRepairStrategy.IG_REWRITES),
                new PrefixInsertion("IG"),
                new SuffixRemoval()));
        return FamilyProfile.builder()
                .catalogs(bundle)
                .grammar(SymbolGrammar.IMMUNOGLOBULIN)
                .oracle(new ReceptorValidityOracle(bundle.getReference()))
                .cascade(cascade)
                .compiler(PrecisionCompiler.RECEPTOR)
                .queryEngine(new ReceptorQueryEngine())
                .motifAnchorFallback(true)
                .build();
    }

    private static FamilyProfile hla(CatalogBundle bundle) {
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                new SynonymSubstitution(false),
                new HlaPrefixRepair(),
                new ForgottenAsterisk(),
                new ForgottenColon(),
                new LeadingZeroSearch()));
        return FamilyProfile.builder()
                .catalogs(bundle)
                .grammar(SymbolGrammar.HLA)
                .oracle(new HlaValidityOracle(bundle.getReference()))
                .cascade(cascade)
                .compiler(PrecisionCompiler.MH)
                .queryEngine(new HlaQueryEngine())
                .build();
    }

    private static FamilyProfile geneOnlyMh(CatalogBundle bundle) {
        return FamilyProfile.builder()
                .catalogs(bundle)
                .grammar(SymbolGrammar.RECEPTOR)
                .oracle(new GeneOnlyValidityOracle(bundle.getReference()))
                .cascade(new ResolutionCascade(List.of(new SynonymSubstitution(true))))
                .compiler(PrecisionCompiler.MH)
                .queryEngine(new GeneOnlyQueryEngine())
                .build();
    }
}

package com.receptor.normalizer.symbol;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.Species;
import com.receptor.normalizer.context.FamilyProfile;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.model.StandardizationResult;
import com.receptor.normalizer.parser.ParsedSymbol;
import com.receptor.normalizer.parser.SymbolCleaner;
import com.receptor.normalizer.symbol.cascade.CascadeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for gene symbol standardization: clean, parse, run the family's
 * resolution cascade, validate, and compile the result.
 */
public class SymbolStandardizer {

    private static final Logger log = LoggerFactory.getLogger(SymbolStandardizer.class);

    private final NormalizerContext context;

    public SymbolStandardizer() {
        this(NormalizerContext.defaultContext());
    }

    public SymbolStandardizer(NormalizerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public StandardizationResult standardize(String symbol, GeneFamily family, String species) {
        return standardize(symbol, family, species, false, false);
    }

    public StandardizationResult standardize(String symbol, GeneFamily family, String species,
            boolean enforceFunctional, boolean allowSubgroup) {
        return standardize(SymbolRequest.builder()
                .symbol(symbol)
                .family(family)
                .species(species)
                .enforceFunctional(enforceFunctional)
                .allowSubgroup(allowSubgroup)
                .build());
    }

    public StandardizationResult standardize(SymbolRequest request) {
        Objects.requireNonNull(request, "request");
        PrecisionCompiler compiler = PrecisionCompiler.forFamily(request.getFamily());
        if (request.getPrecision() != null && !compiler.supports(request.getPrecision())) {
            throw new IllegalArgumentException("Precision " + request.getPrecision() + " is not defined for "
                    + request.getFamily() + "; expected one of " + compiler.supportedPrecisions());
        }

        String speciesKey = Species.normalizeKey(request.getSpecies());
        if (Species.ANY.equals(speciesKey) && request.getFamily() != GeneFamily.MH) {
            return standardizeAnySpecies(request);
        }

        Optional<FamilyProfile> profile = context.profile(speciesKey, request.getFamily());
        if (profile.isEmpty()) {
            String reason = InvalidReason.UNSUPPORTED_SPECIES.getMessage() + ": " + request.getSpecies();
            logFailure(request, reason, request.getSymbol());
            return StandardizationResult.failure(request.getSymbol(), reason, request.getSymbol());
        }
        return standardize(request, profile.get(), true);
    }

    private StandardizationResult standardizeAnySpecies(SymbolRequest request) {
        List<FamilyProfile> profiles = context.profiles(request.getFamily());
        if (profiles.isEmpty()) {
            String reason = InvalidReason.UNSUPPORTED_SPECIES.getMessage() + ": " + request.getSpecies();
            return StandardizationResult.failure(request.getSymbol(), reason, request.getSymbol());
        }
        StandardizationResult first = null;
        for (FamilyProfile profile : profiles) {
            StandardizationResult attempt = standardize(request, profile, false);
            if (attempt.isSuccess()) {
                return attempt;
            }
            if (first == null) {
                first = attempt;
            }
        }
        logFailure(request, first.getError().orElse(""), first.getAttemptedFix().orElse(""));
        return first;
    }

    private StandardizationResult standardize(SymbolRequest request, FamilyProfile profile, boolean logFailures) {
        boolean allowSubgroup = request.isAllowSubgroup() || request.getPrecision() == Precision.SUBGROUP;
        ValidationOptions options = new ValidationOptions(request.isEnforceFunctional(), allowSubgroup);

        ParsedSymbol parsed = profile.getGrammar().parse(SymbolCleaner.clean(request.getSymbol()));
        CascadeContext cascadeContext = new CascadeContext(profile.getReference(), profile.getSynonyms(),
                profile.getOracle(), options, profile.getCascade(), true);
        ParsedSymbol resolved = profile.getCascade().resolve(parsed, cascadeContext);

        PrecisionCompiler compiler = profile.getCompiler();
        Optional<InvalidReason> reason = profile.getOracle().reasonInvalid(resolved, options);
        if (reason.isPresent()) {
            String attemptedFix = compiler.compile(resolved, compiler.highestPrecision(resolved));
            if (logFailures) {
                logFailure(request, reason.get().getMessage(), attemptedFix);
            }
            return StandardizationResult.failure(request.getSymbol(), reason.get().getMessage(), attemptedFix);
        }
        return compile(request, profile, resolved);
    }

    private static StandardizationResult compile(SymbolRequest request, FamilyProfile profile, ParsedSymbol resolved) {
        PrecisionCompiler compiler = profile.getCompiler();
        Precision cap = request.getPrecision() == null ? Precision.ALLELE : request.getPrecision();
        StandardizationResult.StandardizationResultBuilder result = StandardizationResult.builder()
                .originalInput(request.getSymbol());

        boolean subgroupOnly = profile.getOracle() instanceof ReceptorValidityOracle oracle
                && oracle.isSubgroupOnly(resolved.getGene());
        if (subgroupOnly) {
            return result.subgroup(resolved.getGene()).highestPrecision(resolved.getGene()).build();
        }

        Precision reached = Precision.SUBGROUP;
        if (compiler == PrecisionCompiler.RECEPTOR) {
            result.subgroup(compiler.compile(resolved, Precision.SUBGROUP));
        }
        if (cap.compareTo(Precision.GENE) >= 0) {
            result.gene(compiler.compile(resolved, Precision.GENE));
            reached = Precision.GENE;
        }
        List<String> fields = resolved.getAlleleFields();
        if (compiler == PrecisionCompiler.MH && fields.size() >= 2 && cap.compareTo(Precision.PROTEIN) >= 0) {
            result.protein(compiler.compile(resolved, Precision.PROTEIN));
            reached = Precision.PROTEIN;
        }
        if (resolved.hasAllele() && cap == Precision.ALLELE) {
            result.allele(compiler.compile(resolved, Precision.ALLELE));
            reached = Precision.ALLELE;
        }
        if (!compiler.supports(reached)) {
            reached = Precision.GENE;
        }
        return result.highestPrecision(compiler.compile(resolved, reached)).build();
    }

    private void logFailure(SymbolRequest request, String reason, String attemptedFix) {
        if (context.getConfig().isLogFailures()) {
            log.warn("Failed to standardize {} for species {}: {}. Attempted fix \"{}\".", request.getSymbol(),
                    request.getSpecies(), reason, attemptedFix);
        }
    }
}

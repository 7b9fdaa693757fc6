package com.receptor.normalizer.junction;

import com.receptor.normalizer.context.FamilyProfile;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.model.JunctionResult;
import com.receptor.normalizer.model.StandardizationResult;
import com.receptor.normalizer.parser.SymbolCleaner;
import com.receptor.normalizer.symbol.SymbolRequest;
import com.receptor.normalizer.symbol.SymbolStandardizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Verifies, trims or reconstructs the boundaries of CDR3 junctions.
 * <p>
 * The J side is settled first, against the conserved F/W of the candidate J
 * regions, then the V side against the conserved cysteine. Failures of both
 * sides are reported together.
 */
public class JunctionStandardizer {

    private static final Logger log = LoggerFactory.getLogger(JunctionStandardizer.class);

    private static final String C_REPLACEABLE = "WSRGYF";
    private static final String FW_REPLACEABLE = "ILVYSCGR";
    private static final char[] J_ANCHORS = {'F', 'W'};

    private final NormalizerContext context;
    private final SymbolStandardizer symbols;
    private final RegionSelector selector = new RegionSelector();
    private final BoundaryCorrector corrector = new BoundaryCorrector();
    private final JunctionFormatter formatter = new JunctionFormatter();

    public JunctionStandardizer() {
        this(NormalizerContext.defaultContext());
    }

    public JunctionStandardizer(NormalizerContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.symbols = new SymbolStandardizer(context);
    }

    /**
     * Pattern-only standardization, without alignment.
     */
    public JunctionResult standardize(String sequence) {
        return standardize(JunctionRequest.builder().sequence(sequence).build());
    }

    public JunctionResult standardize(String sequence, Locus locus) {
        return standardize(JunctionRequest.builder().sequence(sequence).locus(locus).build());
    }

    public JunctionResult standardize(JunctionRequest request) {
        Objects.requireNonNull(request, "request");
        String original = request.getSequence();
        String sequence = original.strip().toUpperCase(Locale.ROOT);
        JunctionSettings settings = request.getSettings();

        Optional<Character> invalid = AminoAcids.firstInvalidResidue(sequence);
        if (invalid.isPresent()) {
            return fail(settings, original, "not a valid amino acid sequence", original);
        }
        if (request.getLocus() == null) {
            JunctionResult formatted = formatter.format(original, sequence, request.isStrict());
            if (formatted.isFailed()) {
                return fail(settings, original, JunctionFormatter.NOT_A_JUNCTION, sequence);
            }
            return formatted;
        }

        Locus locus = request.getLocus();
        Optional<FamilyProfile> found = context.profile(request.getSpecies(), locus.getFamily());
        if (found.isEmpty()) {
            return fail(settings, original, "unsupported species: " + request.getSpecies(), original);
        }
        FamilyProfile profile = found.get();

        String vSymbol = resolveSymbol(request.getVSymbol(), locus, Segment.V, request.getSpecies());
        String jSymbol = resolveSymbol(request.getJSymbol(), locus, Segment.J, request.getSpecies());

        List<ReferenceRegion> vRegions = selector.select(profile, locus, Segment.V, vSymbol,
                settings.isEnforceFunctionalV());
        List<ReferenceRegion> jRegions = selector.select(profile, locus, Segment.J, jSymbol,
                settings.isEnforceFunctionalJ());
        if (vRegions.isEmpty()) {
            return fail(settings, original, noSequenceInformation(vSymbol, locus, Segment.V), sequence);
        }
        if (jRegions.isEmpty()) {
            return fail(settings, original, noSequenceInformation(jSymbol, locus, Segment.J), sequence);
        }

        JunctionAligner aligner = new JunctionAligner(settings);
        String current = sequence;
        if (settings.isAllowFwCorrection()) {
            current = replaceLastResidue(current, jRegions, aligner);
        }
        if (settings.isAllowCCorrection()) {
            current = replaceFirstResidue(current, vRegions, aligner);
        }

        List<String> errors = new ArrayList<>();

        List<AlignmentCandidate> jAlignments = aligner.alignJ(current, jRegions);
        if (jAlignments.isEmpty()) {
            errors.add("J alignment unsuccessful");
            errors.add("J side reconstruction unsuccessful");
        } else {
            BoundaryCorrector.Outcome outcome = corrector.chooseJ(current, jAlignments,
                    settings.isAllowJReconstruction(), jSymbol != null);
            outcome.getError().ifPresent(errors::add);
            current = outcome.sequence();
        }

        List<AlignmentCandidate> vAlignments = aligner.alignV(current, vRegions);
        if (vAlignments.isEmpty()) {
            errors.add("V alignment unsuccessful");
            errors.add("V side reconstruction unsuccessful");
        } else {
            BoundaryCorrector.Outcome outcome = corrector.chooseV(current, vAlignments,
                    settings.isAllowVReconstruction());
            outcome.getError().ifPresent(errors::add);
            current = outcome.sequence();
        }

        if (current.length() < settings.getMinJunctionLength()) {
            errors.add("junction too short");
        }

        if (!errors.isEmpty()) {
            return fail(settings, original, String.join("; ", errors) + ".", current);
        }
        return JunctionResult.success(original, current);
    }

    /**
     * Standardize a supplied V or J symbol and check it belongs to the locus.
     *
     * @throws IllegalArgumentException when the symbol names a gene of another locus or segment
     */
    private String resolveSymbol(String symbol, Locus locus, Segment segment, String species) {
        if (symbol == null) {
            return null;
        }
        StandardizationResult result = symbols.standardize(SymbolRequest.builder()
                .symbol(symbol)
                .family(locus.getFamily())
                .species(species)
                .allowSubgroup(true)
                .build());
        String resolved = result.isSuccess()
                ? result.getHighestPrecision().orElseThrow()
                : SymbolCleaner.clean(symbol);
        if (!locus.covers(resolved, segment)) {
            throw new IllegalArgumentException(
                    segment + " symbol " + symbol + " is not a " + segment + " gene of locus " + locus);
        }
        return resolved;
    }

    private String replaceLastResidue(String sequence, List<ReferenceRegion> jRegions, JunctionAligner aligner) {
        char last = sequence.isEmpty() ? 0 : sequence.charAt(sequence.length() - 1);
        if (FW_REPLACEABLE.indexOf(last) < 0) {
            return sequence;
        }
        String best = sequence;
        double bestScore = bestScore(aligner.alignJ(sequence, jRegions));
        for (char anchor : J_ANCHORS) {
            String candidate = sequence.substring(0, sequence.length() - 1) + anchor;
            double score = bestScore(aligner.alignJ(candidate, jRegions));
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private String replaceFirstResidue(String sequence, List<ReferenceRegion> vRegions, JunctionAligner aligner) {
        char first = sequence.isEmpty() ? 0 : sequence.charAt(0);
        if (C_REPLACEABLE.indexOf(first) < 0) {
            return sequence;
        }
        String candidate = "C" + sequence.substring(1);
        double before = bestScore(aligner.alignV(sequence, vRegions));
        double after = bestScore(aligner.alignV(candidate, vRegions));
        return after > before ? candidate : sequence;
    }

    private static double bestScore(List<AlignmentCandidate> alignments) {
        return alignments.isEmpty() ? AlignmentScorer.NO_ALIGNMENT : alignments.get(0).score();
    }

    private static String noSequenceInformation(String symbol, Locus locus, Segment segment) {
        return symbol != null
                ? "no known sequence information for " + symbol
                : "no known sequence information for " + locus + " " + segment + " genes";
    }

    private static JunctionResult fail(JunctionSettings settings, String original, String reason, String attempt) {
        if (settings.isLogFailures()) {
            log.warn("Failed to standardize {}: {}. Attempted fix \"{}\".", original, reason, attempt);
        }
        return JunctionResult.failure(original, reason, attempt);
    }
}

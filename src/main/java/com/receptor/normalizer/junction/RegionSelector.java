package com.receptor.normalizer.junction;

import com.receptor.normalizer.catalog.AaSequenceCatalog;
import com.receptor.normalizer.catalog.Functionality;
import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.context.FamilyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the reference regions a junction is aligned against and locates their
 * anchors. Alleles of one gene with identical regions collapse into a single
 * gene-level region.
 */
public class RegionSelector {

    private static final Logger log = LoggerFactory.getLogger(RegionSelector.class);

    private static final Pattern TRAILING_CYSTEINE = Pattern.compile("Y[A-Z]C");

    /**
     * @param symbol gene, subgroup or allele restricting the selection; null selects the whole locus
     */
    public List<ReferenceRegion> select(FamilyProfile profile, Locus locus, Segment segment, String symbol,
            boolean enforceFunctional) {
        AaSequenceCatalog sequences = profile.getSequences();
        List<ReferenceRegion> regions = new ArrayList<>();
        for (String key : sequences.symbols()) {
            if (!locus.covers(key, segment)) {
                continue;
            }
            if (symbol != null && !isExtensionOf(key, symbol)) {
                continue;
            }
            if (enforceFunctional && !isFunctional(profile.getReference(), key)) {
                continue;
            }
            Map<String, String> entry = sequences.regions(key).orElseThrow();
            Optional<ReferenceRegion> region = segment == Segment.J
                    ? joiningRegion(key, entry)
                    : variableRegion(key, entry, profile.isMotifAnchorFallback());
            if (region.isPresent()) {
                regions.add(region.get());
            } else {
                log.debug("No anchor found for {}", key);
            }
        }
        return collapse(regions);
    }

    /**
     * True when the catalogued key is the symbol itself or one of its alleles or sub-genes.
     */
    static boolean isExtensionOf(String key, String symbol) {
        if (key.equals(symbol)) {
            return true;
        }
        if (!key.startsWith(symbol)) {
            return false;
        }
        char next = key.charAt(symbol.length());
        return next == '*' || next == '-' || next == '/';
    }

    static Optional<ReferenceRegion> joiningRegion(String key, Map<String, String> entry) {
        String region = entry.get(AaSequenceCatalog.J_REGION);
        String motif = entry.get(AaSequenceCatalog.J_MOTIF);
        if (region == null || motif == null || region.indexOf(motif) < 0) {
            return Optional.empty();
        }
        return Optional.of(new ReferenceRegion(key, region, region.indexOf(motif)));
    }

    static Optional<ReferenceRegion> variableRegion(String key, Map<String, String> entry, boolean motifFallback) {
        String region = entry.get(AaSequenceCatalog.V_REGION);
        if (region == null) {
            return Optional.empty();
        }
        String fr3 = entry.get(AaSequenceCatalog.FR3);
        if (fr3 != null && fr3.endsWith("C") && region.indexOf(fr3) >= 0) {
            return Optional.of(new ReferenceRegion(key, region, region.indexOf(fr3) + fr3.length() - 1));
        }
        if (!motifFallback) {
            return Optional.empty();
        }
        Matcher m = TRAILING_CYSTEINE.matcher(region);
        int anchor = -1;
        while (m.find()) {
            anchor = m.end() - 1;
        }
        return anchor < 0 ? Optional.empty() : Optional.of(new ReferenceRegion(key, region, anchor));
    }

    private static boolean isFunctional(ReferenceCatalog reference, String key) {
        int star = key.indexOf('*');
        if (star < 0) {
            return reference.hasFunctionalAllele(key);
        }
        return reference.functionality(key.substring(0, star), key.substring(star + 1))
                .filter(Functionality.FUNCTIONAL::equals)
                .isPresent();
    }

    private static List<ReferenceRegion> collapse(List<ReferenceRegion> regions) {
        Map<String, List<ReferenceRegion>> byGene = new LinkedHashMap<>();
        for (ReferenceRegion region : regions) {
            byGene.computeIfAbsent(geneOf(region.label()), g -> new ArrayList<>()).add(region);
        }
        List<ReferenceRegion> collapsed = new ArrayList<>();
        byGene.forEach((gene, alleles) -> {
            ReferenceRegion first = alleles.get(0);
            boolean identical = alleles.stream().allMatch(
                    r -> r.sequence().equals(first.sequence()) && r.anchor() == first.anchor());
            if (identical) {
                collapsed.add(new ReferenceRegion(gene, first.sequence(), first.anchor()));
            } else {
                collapsed.addAll(alleles);
            }
        });
        return collapsed;
    }

    private static String geneOf(String label) {
        int star = label.indexOf('*');
        return star < 0 ? label : label.substring(0, star);
    }
}

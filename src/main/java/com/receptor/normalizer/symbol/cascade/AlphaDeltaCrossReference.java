package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the compound TRAV/DV name of variable genes shared by the alpha and
 * delta loci, from either the alpha or the delta naming.
 */
public class AlphaDeltaCrossReference implements CorrectionStrategy {

    private static final Pattern NUMBERED_DELTA = Pattern.compile("^TR([\\d-]+)/(DV[\\d-]+)$");

    /** Which naming the strategy starts from. */
    public enum Direction {
        FROM_ALPHA,
        FROM_DELTA
    }

    private final Direction direction;

    public AlphaDeltaCrossReference(Direction direction) {
        this.direction = direction;
    }

    @Override
    public String name() {
        return direction == Direction.FROM_ALPHA ? "alpha-to-compound" : "delta-to-compound";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        String gene = symbol.getGene();
        Optional<String> compound = direction == Direction.FROM_ALPHA
                ? fromAlpha(gene, context)
                : fromDelta(gene, context);
        return compound.map(symbol::withGene).orElse(symbol);
    }

    private static Optional<String> fromAlpha(String gene, CascadeContext context) {
        if (!gene.startsWith("TRAV") || gene.contains("DV")) {
            return Optional.empty();
        }
        int slash = gene.lastIndexOf('/');
        if (slash >= 0) {
            return Optional.of(gene.substring(0, slash + 1) + "DV" + gene.substring(slash + 1));
        }
        String stem = gene + "/DV";
        return context.catalog().geneNames().stream()
                .filter(name -> name.startsWith(stem))
                .findFirst();
    }

    private static Optional<String> fromDelta(String gene, CascadeContext context) {
        if (!gene.contains("DV")) {
            return Optional.empty();
        }
        if (gene.startsWith("TRDV")) {
            Pattern compound = Pattern.compile("^TRAV\\d+(-\\d)?/" + Pattern.quote(gene.substring(2)) + "$");
            return context.catalog().geneNames().stream()
                    .filter(name -> compound.matcher(name).matches())
                    .findFirst();
        }
        Matcher m = NUMBERED_DELTA.matcher(gene);
        if (m.matches()) {
            return Optional.of("TRAV" + m.group(1) + "/" + m.group(2));
        }
        return Optional.empty();
    }
}

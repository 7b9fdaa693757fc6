package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.List;

/**
 * Applies a family's affix and delimiter rewrites in order, as one step.
 */
public class NameRepairStrategy implements CorrectionStrategy {

    /** Rewrites for legacy and typo-ridden TR names. */
    public static final List<NameRewrite> TR_REWRITES = List.of(
            NameRewrite.literal("TCR", "TR"),
            NameRewrite.literal("S", "-"),
            NameRewrite.literal(".", "-"),
            NameRewrite.regex("(?<!TR)(?<!/)-?DV", "/DV"),
            NameRewrite.regex("(?<!/)-?OR", "/OR"),
            NameRewrite.regex("(?<!\\d)0+", ""));

    /** Rewrites for IG names. */
    public static final List<NameRewrite> IG_REWRITES = List.of(
            NameRewrite.literal(".", "-"),
            NameRewrite.regex("(?<!/)-?OR", "/OR"),
            NameRewrite.regex("(?<!\\d)0+", ""));

    private final List<NameRewrite> rewrites;

    public NameRepairStrategy(List<NameRewrite> rewrites) {
        this.rewrites = List.copyOf(rewrites);
    }

    @Override
    public String name() {
        return "name-repair";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        String gene = symbol.getGene();
        for (NameRewrite rewrite : rewrites) {
            gene = rewrite.apply(gene);
        }
        return symbol.withGene(gene);
    }
}

package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

/**
 * Drops superfluous "-1" suffixes when the shorter name is catalogued.
 */
public class SuffixRemoval implements CorrectionStrategy {

    @Override
    public String name() {
        return "suffix-removal";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        if (!symbol.getGene().contains("-1")) {
            return symbol;
        }
        return DashOneVariants.removed(symbol.getGene()).stream()
                .filter(context.catalog()::containsGene)
                .findFirst()
                .map(symbol::withGene)
                .orElse(symbol);
    }
}

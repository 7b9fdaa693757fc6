package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

/**
 * Adds or removes "-1" suffixes and re-enters the cascade once per variant.
 * The re-entered cascade runs with retries disabled, so this step never
 * recurses twice.
 */
public class SuffixToggle implements CorrectionStrategy {

    @Override
    public String name() {
        return "suffix-toggle";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        if (!context.mayRetry()) {
            return symbol;
        }
        for (String variant : DashOneVariants.toggled(symbol.getGene())) {
            ParsedSymbol resolved = context.retry(symbol.withGene(variant));
            if (context.accepts(resolved)) {
                return resolved;
            }
        }
        return symbol;
    }
}

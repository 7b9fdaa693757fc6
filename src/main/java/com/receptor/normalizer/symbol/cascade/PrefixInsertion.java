package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

/**
 * Prepends the family prefix ("TR", "IG") when it is missing.
 */
public class PrefixInsertion implements CorrectionStrategy {

    private final String prefix;

    public PrefixInsertion(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String name() {
        return "prefix";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        if (symbol.getGene().startsWith(prefix)) {
            return symbol;
        }
        return symbol.withGene(prefix + symbol.getGene());
    }
}

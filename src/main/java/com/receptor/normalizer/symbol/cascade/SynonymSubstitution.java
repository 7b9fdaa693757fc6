package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

/**
 * Replaces a deprecated or alias gene name by its current name.
 */
public class SynonymSubstitution implements CorrectionStrategy {

    private final boolean ignoreDashes;

    /**
     * @param ignoreDashes look the alias up with dashes removed (mouse MH tables)
     */
    public SynonymSubstitution(boolean ignoreDashes) {
        this.ignoreDashes = ignoreDashes;
    }

    @Override
    public String name() {
        return "synonym";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        String key = ignoreDashes ? symbol.getGene().replace("-", "") : symbol.getGene();
        return context.synonyms().resolve(key)
                .map(symbol::withGene)
                .orElse(symbol);
    }
}

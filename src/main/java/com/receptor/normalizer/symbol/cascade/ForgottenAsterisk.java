package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;
import com.receptor.normalizer.parser.SymbolGrammar;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits designations glued to the gene name, as in "HLA-B8".
 */
public class ForgottenAsterisk implements CorrectionStrategy {

    private static final Pattern GLUED = Pattern.compile("^(HLA-[A-Z]+)([\\d:]+G?P?)$");

    @Override
    public String name() {
        return "forgotten-asterisk";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        if (symbol.hasAllele()) {
            return symbol;
        }
        Matcher m = GLUED.matcher(symbol.getGene());
        if (!m.matches()) {
            return symbol;
        }
        return new ParsedSymbol(m.group(1), SymbolGrammar.splitFields(m.group(2)));
    }
}

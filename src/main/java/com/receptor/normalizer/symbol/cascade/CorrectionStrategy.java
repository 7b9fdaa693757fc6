package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

/**
 * One named step of the resolution cascade. A strategy either fully rewrites
 * its input or returns it unchanged.
 */
public interface CorrectionStrategy {

    String name();

    ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context);
}

package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a four digit first field into two fields ("5701" to "57:01").
 */
public class ForgottenColon implements CorrectionStrategy {

    @Override
    public String name() {
        return "forgotten-colon";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        List<String> fields = symbol.getAlleleFields();
        if (fields.isEmpty() || fields.get(0).length() != 4) {
            return symbol;
        }
        String first = fields.get(0);
        List<String> split = new ArrayList<>();
        split.add(first.substring(0, 2));
        split.add(first.substring(2));
        split.addAll(fields.subList(1, fields.size()));
        return symbol.withAlleleFields(split);
    }
}

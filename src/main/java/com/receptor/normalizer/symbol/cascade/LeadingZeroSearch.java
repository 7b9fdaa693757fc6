package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Tries two and three digit widths for the first two designation fields and
 * keeps the first combination the oracle accepts.
 */
public class LeadingZeroSearch implements CorrectionStrategy {

    private static final int SEARCHED_FIELDS = 2;
    private static final int[] WIDTHS = {2, 3};

    @Override
    public String name() {
        return "leading-zeros";
    }

    @Override
    public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
        List<String> fields = symbol.getAlleleFields();
        if (fields.isEmpty()) {
            return symbol;
        }
        int searched = Math.min(SEARCHED_FIELDS, fields.size());
        List<String> rest = fields.subList(searched, fields.size());

        List<List<String>> heads = new ArrayList<>();
        heads.add(new ArrayList<>());
        for (int i = 0; i < searched; i++) {
            List<String> widths = widthsOf(fields.get(i));
            List<List<String>> next = new ArrayList<>();
            for (List<String> head : heads) {
                for (String width : widths) {
                    List<String> extended = new ArrayList<>(head);
                    extended.add(width);
                    next.add(extended);
                }
            }
            heads = next;
        }

        for (List<String> head : heads) {
            List<String> candidate = new ArrayList<>(head);
            candidate.addAll(rest);
            ParsedSymbol variant = symbol.withAlleleFields(candidate);
            if (context.accepts(variant)) {
                return variant;
            }
        }
        return symbol;
    }

    private static List<String> widthsOf(String field) {
        if (field.isEmpty() || !field.chars().allMatch(Character::isDigit)) {
            return List.of(field);
        }
        String digits = field.replaceFirst("^0+", "");
        if (digits.isEmpty()) {
            digits = "0";
        }
        List<String> widths = new ArrayList<>();
        for (int width : WIDTHS) {
            String padded = digits.length() >= width ? digits : "0".repeat(width - digits.length()) + digits;
            if (!widths.contains(padded)) {
                widths.add(padded);
            }
        }
        return widths;
    }
}

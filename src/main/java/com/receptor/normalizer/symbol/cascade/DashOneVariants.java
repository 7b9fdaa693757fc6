package com.receptor.normalizer.symbol.cascade;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enumerates spellings of a gene name with the optional "-1" suffix of its
 * numeric tokens added or removed. The enumeration is a bounded product over
 * the tokens of the name, in catalog-independent order.
 */
final class DashOneVariants {

    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\d+(-\\d+)?");
    private static final Pattern OPTIONAL_DASH_ONE = Pattern.compile("(\\d+)(-1)?");
    private static final Pattern REQUIRED_DASH_ONE = Pattern.compile("(\\d+)-1");

    private DashOneVariants() {
    }

    /**
     * Every token may gain or lose its "-1" suffix.
     */
    static List<String> toggled(String gene) {
        return expand(gene, OPTIONAL_DASH_ONE, true);
    }

    /**
     * Tokens ending in "-1" may lose it.
     */
    static List<String> removed(String gene) {
        return expand(gene, REQUIRED_DASH_ONE, false);
    }

    private static List<String> expand(String gene, Pattern eligible, boolean suffixFirst) {
        List<String> literals = new ArrayList<>();
        List<List<String>> choices = new ArrayList<>();

        Matcher tokens = NUMBER_TOKEN.matcher(gene);
        int last = 0;
        while (tokens.find()) {
            Matcher token = eligible.matcher(tokens.group());
            if (!token.matches()) {
                continue;
            }
            literals.add(gene.substring(last, tokens.start()));
            String number = token.group(1);
            choices.add(suffixFirst ? List.of(number + "-1", number) : List.of(tokens.group(), number));
            last = tokens.end();
        }
        String tail = gene.substring(last);

        List<String> variants = new ArrayList<>();
        if (choices.isEmpty()) {
            return variants;
        }
        combine(literals, choices, tail, 0, new StringBuilder(), variants);
        variants.removeIf(gene::equals);
        return variants;
    }

    private static void combine(List<String> literals, List<List<String>> choices, String tail, int index,
            StringBuilder prefix, List<String> out) {
        if (index == choices.size()) {
            out.add(prefix + tail);
            return;
        }
        for (String choice : choices.get(index)) {
            int mark = prefix.length();
            prefix.append(literals.get(index)).append(choice);
            combine(literals, choices, tail, index + 1, prefix, out);
            prefix.setLength(mark);
        }
    }
}

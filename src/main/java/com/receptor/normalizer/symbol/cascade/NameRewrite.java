package com.receptor.normalizer.symbol.cascade;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single string rewrite applied to a gene name.
 */
public record NameRewrite(Pattern pattern, String replacement) {

    public static NameRewrite literal(String target, String replacement) {
        return new NameRewrite(Pattern.compile(Pattern.quote(target)), Matcher.quoteReplacement(replacement));
    }

    public static NameRewrite regex(String regex, String replacement) {
        return new NameRewrite(Pattern.compile(regex), replacement);
    }

    public String apply(String gene) {
        return pattern.matcher(gene).replaceAll(replacement);
    }
}

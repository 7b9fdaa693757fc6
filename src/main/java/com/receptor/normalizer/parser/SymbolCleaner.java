package com.receptor.normalizer.parser;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strips pollutants from raw symbols before parsing.
 */
@UtilityClass
public class SymbolCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(raw).replaceAll("");
        cleaned = cleaned.replace("&nbsp;", "").replace("&ndash;", "-");
        return cleaned.toUpperCase(Locale.ROOT);
    }
}

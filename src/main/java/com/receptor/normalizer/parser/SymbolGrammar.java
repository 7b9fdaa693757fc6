package com.receptor.normalizer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Family-specific symbol grammars. Input must already be cleaned; parsing
 * never fails, an unmatched input becomes a gene name without allele.
 */
public enum SymbolGrammar {

    /** TR genes and mouse MH genes: {@code GENE*NN}. */
    RECEPTOR {
        @Override
        public ParsedSymbol parse(String cleaned) {
            return parseSingleField(RECEPTOR_PATTERN, cleaned);
        }
    },

    /** IG genes, where orphon a/b suffixes stay lower case. */
    IMMUNOGLOBULIN {
        @Override
        public ParsedSymbol parse(String cleaned) {
            Matcher orphon = IG_ORPHON_SUFFIX.matcher(cleaned);
            String prepared = cleaned;
            if (orphon.lookingAt()) {
                prepared = orphon.group(1) + orphon.group(2).toLowerCase(Locale.ROOT) + cleaned.substring(orphon.end());
            }
            return parseSingleField(IG_PATTERN, prepared);
        }
    },

    /** HLA genes with colon separated fields and optional expression suffix. */
    HLA {
        @Override
        public ParsedSymbol parse(String cleaned) {
            if (B2M.equals(cleaned)) {
                return ParsedSymbol.ofGene(B2M);
            }
            String prepared = DOTTED_FIELD.matcher(cleaned).replaceAll(":");

            Matcher classTwo = HLA_CLASS_TWO_PATTERN.matcher(prepared);
            if (classTwo.lookingAt()) {
                return new ParsedSymbol(classTwo.group(1), splitFields(classTwo.group(5)));
            }
            Matcher general = HLA_PATTERN.matcher(prepared);
            if (general.lookingAt()) {
                return new ParsedSymbol(general.group(1), splitFields(general.group(3)));
            }
            return ParsedSymbol.ofGene(prepared);
        }
    };

    public static final String B2M = "B2M";

    private static final Pattern RECEPTOR_PATTERN = Pattern.compile("^([A-Z0-9\\-\\.\\(\\)\\/]+)(\\*(\\d+))?");
    private static final Pattern IG_PATTERN = Pattern.compile("^([A-Z0-9\\-\\.\\(\\)\\/ab]+)(\\*(\\d+))?");
    private static final Pattern IG_ORPHON_SUFFIX = Pattern.compile("(.*?OR15-\\d)([AB])");
    private static final Pattern DOTTED_FIELD = Pattern.compile("(?<=\\d)\\.(?=\\d)");
    private static final Pattern HLA_CLASS_TWO_PATTERN = Pattern
            .compile("^((HLA-)?(D[PQ][AB]|DRB|TAP)\\d)(\\*?([\\d:]+G?P?)[LSCAQN]?)?");
    private static final Pattern HLA_PATTERN = Pattern
            .compile("^([A-Z0-9\\-\\.\\:\\/]+)(\\*([\\d:]+G?P?)[LSCAQN]?)?");

    public abstract ParsedSymbol parse(String cleaned);

    /**
     * Zero-pad a purely numeric field to width two; other fields pass through.
     */
    public static String padField(String field) {
        if (field.isEmpty() || !field.chars().allMatch(Character::isDigit)) {
            return field;
        }
        String stripped = field.replaceFirst("^0+", "");
        if (stripped.isEmpty()) {
            stripped = "0";
        }
        return stripped.length() >= 2 ? stripped : "0" + stripped;
    }

    /**
     * Split a colon separated designation, padding numeric fields.
     */
    public static List<String> splitFields(String designation) {
        List<String> fields = new ArrayList<>();
        if (designation == null || designation.isEmpty()) {
            return fields;
        }
        for (String field : designation.split(":")) {
            if (!field.isEmpty()) {
                fields.add(padField(field));
            }
        }
        return fields;
    }

    private static ParsedSymbol parseSingleField(Pattern pattern, String cleaned) {
        Objects.requireNonNull(cleaned, "cleaned");
        Matcher m = pattern.matcher(cleaned);
        if (!m.lookingAt()) {
            return ParsedSymbol.ofGene(cleaned);
        }
        String allele = m.group(3);
        return new ParsedSymbol(m.group(1), allele == null ? List.of() : List.of(padField(allele)));
    }
}

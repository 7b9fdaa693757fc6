package com.receptor.normalizer.catalog;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Species with bundled catalogs. Keys are compared after whitespace removal and
 * lower-casing, so "Homo sapiens" and "homosapiens" are the same species.
 */
public enum Species {
    HOMO_SAPIENS("homosapiens"),
    MUS_MUSCULUS("musmusculus");

    /** Pseudo species key that tries every registered species in order. */
    public static final String ANY = "any";

    private final String key;

    Species(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static String normalizeKey(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    public static Optional<Species> fromKey(String raw) {
        String normalized = normalizeKey(raw);
        return Arrays.stream(values())
                .filter(s -> s.key.equals(normalized))
                .findFirst();
    }
}

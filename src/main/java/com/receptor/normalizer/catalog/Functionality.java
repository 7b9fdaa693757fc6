package com.receptor.normalizer.catalog;

import java.util.Arrays;
import java.util.Optional;

/**
 * Functionality labels found at the leaves of TR and IG catalogs.
 */
public enum Functionality {
    FUNCTIONAL("F"),
    ORF("ORF"),
    PSEUDOGENE("P");

    private final String label;

    Functionality(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolve a catalog leaf label. Group tags of MH catalogs resolve to empty.
     */
    public static Optional<Functionality> fromLabel(Object label) {
        if (!(label instanceof String s)) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(f -> f.label.equals(s))
                .findFirst();
    }
}

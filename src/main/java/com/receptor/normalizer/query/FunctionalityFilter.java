package com.receptor.normalizer.query;

import com.receptor.normalizer.catalog.Functionality;

import java.util.Optional;

/**
 * Functionality restriction for catalog queries. {@code NF} selects every
 * non-functional allele, that is ORF and pseudogenes.
 */
public enum FunctionalityFilter {
    ANY,
    F,
    NF,
    P,
    ORF;

    public boolean matches(Object leafLabel) {
        if (this == ANY) {
            return true;
        }
        Optional<Functionality> functionality = Functionality.fromLabel(leafLabel);
        if (functionality.isEmpty()) {
            return false;
        }
        return switch (this) {
            case F -> functionality.get() == Functionality.FUNCTIONAL;
            case NF -> functionality.get() != Functionality.FUNCTIONAL;
            case P -> functionality.get() == Functionality.PSEUDOGENE;
            case ORF -> functionality.get() == Functionality.ORF;
            case ANY -> true;
        };
    }
}

package com.receptor.normalizer.parser;

import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Candidate gene name plus its ordered allele-designation fields. Correction
 * strategies derive new instances instead of editing one in place.
 */
@Value
@With
public class ParsedSymbol {
    String gene;
    List<String> alleleFields;

    public ParsedSymbol(String gene, List<String> alleleFields) {
        this.gene = Objects.requireNonNull(gene, "gene");
        this.alleleFields = List.copyOf(Objects.requireNonNull(alleleFields, "alleleFields"));
    }

    public static ParsedSymbol ofGene(String gene) {
        return new ParsedSymbol(gene, List.of());
    }

    public boolean hasAllele() {
        return !alleleFields.isEmpty();
    }

    /**
     * Single-field allele number used by TR and IG symbols.
     */
    public String firstField() {
        return alleleFields.isEmpty() ? null : alleleFields.get(0);
    }

    @Override
    public String toString() {
        return hasAllele() ? gene + "*" + String.join(":", alleleFields) : gene;
    }
}

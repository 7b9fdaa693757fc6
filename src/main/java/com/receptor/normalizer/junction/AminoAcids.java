package com.receptor.normalizer.junction;

import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * The twenty standard amino-acid one letter codes.
 */
@UtilityClass
public class AminoAcids {

    public static final String ALPHABET = "ACDEFGHIKLMNPQRSTVWY";

    public static boolean isAminoAcid(char residue) {
        return ALPHABET.indexOf(residue) >= 0;
    }

    /**
     * @return the first character that is not an amino acid, if any
     */
    public static Optional<Character> firstInvalidResidue(String sequence) {
        for (int i = 0; i < sequence.length(); i++) {
            char residue = sequence.charAt(i);
            if (!isAminoAcid(residue)) {
                return Optional.of(residue);
            }
        }
        return sequence.isEmpty() ? Optional.of(' ') : Optional.empty();
    }
}

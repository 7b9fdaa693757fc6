package com.receptor.normalizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a symbol standardization. Graduated accessors are empty unless
 * that precision was actually reached; the attempted fix is only present on
 * failure.
 */
@Value
@Builder
public class StandardizationResult {
    String originalInput;
    String error;
    String subgroup;
    String gene;
    String protein;
    String allele;
    String highestPrecision;
    String attemptedFix;

    public static StandardizationResult failure(String originalInput, String error, String attemptedFix) {
        return StandardizationResult.builder()
                .originalInput(originalInput)
                .error(error)
                .attemptedFix(attemptedFix)
                .build();
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailed() {
        return !isSuccess();
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<String> getSubgroup() {
        return Optional.ofNullable(subgroup);
    }

    public Optional<String> getGene() {
        return Optional.ofNullable(gene);
    }

    public Optional<String> getProtein() {
        return Optional.ofNullable(protein);
    }

    public Optional<String> getAllele() {
        return Optional.ofNullable(allele);
    }

    public Optional<String> getHighestPrecision() {
        return Optional.ofNullable(highestPrecision);
    }

    public Optional<String> getAttemptedFix() {
        return Optional.ofNullable(attemptedFix);
    }

    /**
     * Allele when reached, gene otherwise.
     */
    public Optional<String> getAlleleOrGene() {
        return getAllele().or(this::getGene);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "StandardizationResult[" + originalInput + " -> " + highestPrecision + "]";
        }
        return "StandardizationResult[" + originalInput + " failed: " + error + ", attempted " + attemptedFix + "]";
    }
}

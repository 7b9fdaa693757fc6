package com.receptor.normalizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a junction standardization. Several failure reasons are joined
 * into one error string.
 */
@Value
@Builder
public class JunctionResult {
    String originalInput;
    String error;
    String junction;
    String attemptedFix;

    public static JunctionResult success(String originalInput, String junction) {
        return JunctionResult.builder().originalInput(originalInput).junction(junction).build();
    }

    public static JunctionResult failure(String originalInput, String error, String attemptedFix) {
        return JunctionResult.builder().originalInput(originalInput).error(error).attemptedFix(attemptedFix).build();
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

    public Optional<String> getJunction() {
        return Optional.ofNullable(junction);
    }

    /**
     * Junction without its conserved boundary residues.
     */
    public Optional<String> getCdr3() {
        return getJunction()
                .filter(j -> j.length() > 2)
                .map(j -> j.substring(1, j.length() - 1));
    }

    public Optional<String> getAttemptedFix() {
        return Optional.ofNullable(attemptedFix);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "JunctionResult[" + originalInput + " -> " + junction + "]";
        }
        return "JunctionResult[" + originalInput + " failed: " + error + ", attempted " + attemptedFix + "]";
    }
}

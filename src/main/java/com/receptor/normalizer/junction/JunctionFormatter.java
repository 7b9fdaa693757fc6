package com.receptor.normalizer.junction;

import com.receptor.normalizer.model.JunctionResult;

import java.util.regex.Pattern;

/**
 * Pattern-only junction check used when no locus is given: a junction starts
 * with C and ends with F or W, otherwise both boundary residues are added.
 */
public class JunctionFormatter {

    static final String NOT_A_JUNCTION = "not a valid junction";

    private static final Pattern JUNCTION = Pattern.compile("^C[A-Z]*[FW]$");

    public JunctionResult format(String original, String sequence, boolean strict) {
        if (JUNCTION.matcher(sequence).matches()) {
            return JunctionResult.success(original, sequence);
        }
        if (strict) {
            return JunctionResult.failure(original, NOT_A_JUNCTION, sequence);
        }
        return JunctionResult.success(original, "C" + sequence + "F");
    }
}

package com.receptor.normalizer.junction;

/**
 * Gene segment types used by the junction aligner.
 */
public enum Segment {
    V('V'),
    J('J');

    private final char code;

    Segment(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }
}

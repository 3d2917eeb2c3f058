package com.graphdraw.lgl.api;

/**
 * One of the four direction-biased alignments computed during x positioning.
 * U/D is the vertical sweep direction, L/R the horizontal bias.
 */
public enum Alignment {
    UL,
    UR,
    DL,
    DR;

    public boolean isUp() {
        return this == UL || this == UR;
    }

    public boolean isLeft() {
        return this == UL || this == DL;
    }

    /** Returns null for a blank string, meaning "balance all four". */
    public static Alignment fromString(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment: " + s);
        }
    }
}

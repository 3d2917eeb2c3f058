package com.graphdraw.lgl.api;

/**
 * Drawing direction of the ranks.
 *
 * TB is the canonical orientation: ranks grow downwards and the order within a
 * rank runs left to right. Every other direction is produced by rotating or
 * reflecting a TB layout.
 */
public enum Direction {
    TB,
    BT,
    LR,
    RL;

    /** True when ranks run along the x axis. */
    public boolean isHorizontal() {
        return this == LR || this == RL;
    }

    /** True when the rank axis points against the canonical one. */
    public boolean isReversed() {
        return this == BT || this == RL;
    }

    public static Direction fromString(String s) {
        if (s == null || s.isBlank())
            return TB;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown direction: " + s);
        }
    }
}

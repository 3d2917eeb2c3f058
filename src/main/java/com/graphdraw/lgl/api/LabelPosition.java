package com.graphdraw.lgl.api;

/** Where an edge label sits relative to its edge. */
public enum LabelPosition {
    L,
    C,
    R;

    public static LabelPosition fromString(String s) {
        if (s == null || s.isBlank())
            return R;
        return switch (s.trim().toLowerCase()) {
            case "l", "left" -> L;
            case "c", "center" -> C;
            case "r", "right" -> R;
            default -> throw new IllegalArgumentException("Unknown label position: " + s);
        };
    }
}

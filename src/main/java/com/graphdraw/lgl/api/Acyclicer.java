package com.graphdraw.lgl.api;

/** Strategy used to pick the feedback edge set that gets reversed. */
public enum Acyclicer {
    /** Back edges of a depth-first search in insertion order. */
    DFS,
    /** Eades-Lin-Smyth greedy heuristic, weighted by edge weight. */
    GREEDY;

    public static Acyclicer fromString(String s) {
        if (s == null || s.isBlank())
            return DFS;
        return switch (s.trim().toLowerCase()) {
            case "dfs" -> DFS;
            case "greedy" -> GREEDY;
            default -> throw new IllegalArgumentException("Unknown acyclicer: " + s);
        };
    }
}

package com.graphdraw.lgl.api;

/** Rank assignment strategy. */
public enum RankerKind {
    NETWORK_SIMPLEX,
    /** Longest path followed by a feasible tight tree, without pivoting. */
    TIGHT_TREE,
    LONGEST_PATH;

    public static RankerKind fromString(String s) {
        if (s == null || s.isBlank())
            return NETWORK_SIMPLEX;
        return switch (s.trim().toLowerCase()) {
            case "network-simplex" -> NETWORK_SIMPLEX;
            case "tight-tree" -> TIGHT_TREE;
            case "longest-path" -> LONGEST_PATH;
            default -> throw new IllegalArgumentException("Unknown ranker: " + s);
        };
    }
}

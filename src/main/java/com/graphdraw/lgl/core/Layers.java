package com.graphdraw.lgl.core;

import java.util.ArrayList;
import java.util.List;

/** Rank-level helpers shared by the ordering and positioning stages. */
public final class Layers {

    private Layers() {
    }

    /** Largest rank in the graph, or -1 when no node is ranked. */
    public static int maxRank(LayoutGraph g) {
        int max = -1;
        for (String v : g.nodes()) {
            Integer rank = g.node(v).getRank();
            if (rank != null && rank > max)
                max = rank;
        }
        return max;
    }

    /**
     * Nodes grouped by rank and sorted by order. Nodes without a rank (clusters)
     * are skipped.
     */
    public static List<List<String>> buildLayerMatrix(LayoutGraph g) {
        int max = maxRank(g);
        List<List<String>> layers = new ArrayList<>(max + 1);
        for (int i = 0; i <= max; i++)
            layers.add(new ArrayList<>());
        for (String v : g.nodes()) {
            NodeLabel label = g.node(v);
            if (label.getRank() != null)
                layers.get(label.getRank()).add(v);
        }
        for (List<String> layer : layers)
            layer.sort((a, b) -> Integer.compare(orderOf(g, a), orderOf(g, b)));
        return layers;
    }

    private static int orderOf(LayoutGraph g, String v) {
        Integer order = g.node(v).getOrder();
        return order == null ? Integer.MAX_VALUE : order;
    }
}

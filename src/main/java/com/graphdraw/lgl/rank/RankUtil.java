package com.graphdraw.lgl.rank;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.Graphs;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.ArrayList;
import java.util.List;

/** Rank helpers shared by the rankers and the pipeline. */
public final class RankUtil {

    private RankUtil() {
    }

    /**
     * Initial feasible ranking: every node is pulled as far down as its
     * successors allow, sinks sit on rank 0 and everything else is negative.
     */
    public static void longestPath(LayoutGraph g) {
        for (String v : Graphs.postorder(g, g.sources())) {
            Integer rank = null;
            for (EdgeKey e : g.outEdges(v)) {
                int candidate = g.node(e.w()).getRank() - g.edge(e).getMinlen();
                if (rank == null || candidate < rank)
                    rank = candidate;
            }
            g.node(v).setRank(rank == null ? 0 : rank);
        }
    }

    /** Amount by which the edge is longer than its minimum length. */
    public static int slack(LayoutGraph g, EdgeKey e) {
        return g.node(e.w()).getRank() - g.node(e.v()).getRank() - g.edge(e).getMinlen();
    }

    /** Shifts ranks so the smallest one is 0. Unranked nodes are ignored. */
    public static void normalizeRanks(LayoutGraph g) {
        int min = Integer.MAX_VALUE;
        for (String v : g.nodes()) {
            Integer rank = g.node(v).getRank();
            if (rank != null && rank < min)
                min = rank;
        }
        if (min == Integer.MAX_VALUE || min == 0)
            return;
        for (String v : g.nodes()) {
            NodeLabel label = g.node(v);
            if (label.getRank() != null)
                label.setRank(label.getRank() - min);
        }
    }

    /**
     * Closes rank gaps that hold no node, except on multiples of the node rank
     * factor: those are the ranks real nodes were spaced on by the nesting
     * graph.
     */
    public static void removeEmptyRanks(LayoutGraph g, LayoutContext ctx) {
        int factor = ctx.nodeRankFactor();
        int offset = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (String v : g.nodes()) {
            Integer rank = g.node(v).getRank();
            if (rank != null) {
                offset = Math.min(offset, rank);
                max = Math.max(max, rank);
            }
        }
        if (offset == Integer.MAX_VALUE || factor <= 0)
            return;

        List<List<String>> layers = new ArrayList<>();
        for (int i = 0; i <= max - offset; i++)
            layers.add(new ArrayList<>());
        for (String v : g.nodes()) {
            Integer rank = g.node(v).getRank();
            if (rank != null)
                layers.get(rank - offset).add(v);
        }

        int delta = 0;
        for (int i = 0; i < layers.size(); i++) {
            List<String> vs = layers.get(i);
            if (vs.isEmpty() && i % factor != 0) {
                --delta;
            } else if (!vs.isEmpty() && delta != 0) {
                for (String v : vs)
                    g.node(v).setRank(g.node(v).getRank() + delta);
            }
        }
    }

    /** Sets each cluster's rank span from its top and bottom border nodes. */
    public static void assignRankMinMax(LayoutGraph g, LayoutContext ctx) {
        int maxRank = 0;
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            if (node.getBorderTop() == null)
                continue;
            node.setMinRank(g.node(node.getBorderTop()).getRank());
            node.setMaxRank(g.node(node.getBorderBottom()).getRank());
            maxRank = Math.max(maxRank, node.getMaxRank());
        }
        ctx.setMaxRank(maxRank);
    }
}

package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.List;
import java.util.Objects;

/**
 * Local refinement: swaps neighbouring nodes of a rank whenever that strictly
 * reduces the crossings of their edges with both adjacent ranks. Only
 * siblings in the cluster hierarchy are swapped, and never border nodes, so
 * cluster contiguity is kept. Passes repeat until one makes no swap.
 */
final class Transpose {

    private Transpose() {
    }

    /** Returns the number of swaps performed. Orders on {@code g} are updated. */
    static int run(LayoutGraph g, List<List<String>> layering) {
        int maxPasses = g.nodeCount() + 1;
        int swaps = 0;
        boolean improved = true;
        for (int pass = 0; improved && pass < maxPasses; pass++) {
            improved = false;
            for (List<String> layer : layering) {
                for (int i = 0; i + 1 < layer.size(); i++) {
                    String u = layer.get(i);
                    String w = layer.get(i + 1);
                    if (!canSwap(g, u, w))
                        continue;
                    if (crossings(g, w, u) < crossings(g, u, w)) {
                        layer.set(i, w);
                        layer.set(i + 1, u);
                        g.node(w).setOrder(i);
                        g.node(u).setOrder(i + 1);
                        improved = true;
                        swaps++;
                    }
                }
            }
        }
        return swaps;
    }

    private static boolean canSwap(LayoutGraph g, String u, String w) {
        NodeLabel a = g.node(u);
        NodeLabel b = g.node(w);
        return !a.isBorder() && !b.isBorder() && Objects.equals(g.parent(u), g.parent(w));
    }

    /** Weighted crossings between the edges of {@code left} and {@code right}, left placed first. */
    static double crossings(LayoutGraph g, String left, String right) {
        double total = 0;
        List<EdgeKey> leftIn = g.inEdges(left);
        List<EdgeKey> rightIn = g.inEdges(right);
        for (EdgeKey a : leftIn) {
            for (EdgeKey b : rightIn) {
                if (order(g, a.v()) > order(g, b.v()))
                    total += g.edge(a).getWeight() * g.edge(b).getWeight();
            }
        }
        List<EdgeKey> leftOut = g.outEdges(left);
        List<EdgeKey> rightOut = g.outEdges(right);
        for (EdgeKey a : leftOut) {
            for (EdgeKey b : rightOut) {
                if (order(g, a.w()) > order(g, b.w()))
                    total += g.edge(a).getWeight() * g.edge(b).getWeight();
            }
        }
        return total;
    }

    private static int order(LayoutGraph g, String v) {
        return g.node(v).getOrder();
    }
}

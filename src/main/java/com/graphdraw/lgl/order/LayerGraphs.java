package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.Graph;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.List;

/**
 * Builds the per-rank graphs the ordering sweeps work on.
 *
 * A layer graph holds the nodes of one rank together with the clusters that
 * span it, arranged in the same hierarchy under a synthetic root. Edges run
 * from the neighbours on the adjacent rank (the previous rank for downward
 * sweeps, the next one for upward sweeps) into the layer's nodes; parallel
 * edges are merged by summing their weights. The neighbours themselves are
 * plain top-level nodes and never move.
 */
final class LayerGraphs {

    private LayerGraphs() {
    }

    static Graph<String, LayerNode, Double> build(LayoutGraph g, int rank, boolean inEdges, String root) {
        Graph<String, LayerNode, Double> result = new Graph<>(false, true);
        result.setGraph(root);
        result.setNode(root, LayerNode.root());

        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            boolean onRank = node.getRank() != null && node.getRank() == rank;
            boolean spansRank = node.getMinRank() != null && node.getMinRank() <= rank && rank <= node.getMaxRank();
            if (!onRank && !spansRank)
                continue;

            ensureNode(result, g, v, rank);
            String parent = g.parent(v);
            if (parent != null)
                ensureNode(result, g, parent, rank);
            result.setParent(v, parent != null ? parent : root);

            List<EdgeKey> edges = inEdges ? g.inEdges(v) : g.outEdges(v);
            for (EdgeKey e : edges) {
                String u = e.v().equals(v) ? e.w() : e.v();
                ensureNode(result, g, u, rank);
                Double existing = result.edge(u, v);
                double weight = existing != null ? existing : 0;
                result.setEdge(u, v, g.edge(e).getWeight() + weight);
            }
        }
        return result;
    }

    private static void ensureNode(Graph<String, LayerNode, Double> lg, LayoutGraph g, String v, int rank) {
        if (lg.hasNode(v))
            return;
        NodeLabel node = g.node(v);
        if (node.getBorderLeft() != null && node.getMinRank() != null)
            lg.setNode(v, new LayerNode(node, node.getBorderLeft().get(rank), node.getBorderRight().get(rank)));
        else
            lg.setNode(v, LayerNode.of(node));
    }

    /** A node id that does not occur in {@code g}. */
    static String rootId(LayoutGraph g) {
        String v;
        int i = 0;
        do {
            v = "_layerRoot" + (++i);
        } while (g.hasNode(v));
        return v;
    }
}

package com.graphdraw.lgl.normalize;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

/**
 * Pins the rank of every edge label while ranks are still being compacted.
 *
 * A proxy node is placed on the middle rank of each labelled edge (rounded
 * toward the tail) and moves with the rank adjustments that follow ranking.
 * Removing the proxies stores the final rank on the edge as its label rank.
 */
public final class EdgeLabelProxies {

    private EdgeLabelProxies() {
    }

    public static void inject(LayoutGraph g, LayoutContext ctx) {
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            if (!edge.hasLabelBox())
                continue;
            int vRank = g.node(e.v()).getRank();
            int wRank = g.node(e.w()).getRank();
            NodeLabel label = new NodeLabel();
            label.setRank(vRank + (wRank - vRank) / 2);
            label.setEdgeObj(e);
            ctx.addDummyNode(g, DummyKind.EDGE_PROXY, label, "_ep");
        }
    }

    public static void remove(LayoutGraph g) {
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            if (node.getDummy() != DummyKind.EDGE_PROXY)
                continue;
            EdgeLabel edge = g.edge(node.getEdgeObj());
            if (edge == null)
                throw new IllegalStateException("Edge proxy " + v + " points at missing edge " + node.getEdgeObj());
            edge.setLabelRank(node.getRank());
            g.removeNode(v);
        }
    }
}

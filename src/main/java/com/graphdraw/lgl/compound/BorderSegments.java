package com.graphdraw.lgl.compound;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.HashMap;
import java.util.Map;

/**
 * Left and right cluster borders.
 *
 * {@link #add} gives every cluster one left and one right border dummy per
 * rank it spans, chained top to bottom. Ordering keeps them at the outer ends
 * of the cluster and positioning keeps them apart, so after positioning
 * {@link #remove} can read the cluster rectangle off the border coordinates.
 */
public final class BorderSegments {

    private BorderSegments() {
    }

    public static void add(LayoutGraph g, LayoutContext ctx) {
        for (String v : g.children(null))
            addRecursive(g, ctx, v);
    }

    private static void addRecursive(LayoutGraph g, LayoutContext ctx, String v) {
        for (String child : g.children(v))
            addRecursive(g, ctx, child);

        NodeLabel node = g.node(v);
        if (node.getMinRank() == null)
            return;
        node.setBorderLeft(new HashMap<>());
        node.setBorderRight(new HashMap<>());
        for (int rank = node.getMinRank(); rank <= node.getMaxRank(); ++rank) {
            addBorderNode(g, ctx, DummyKind.BORDER_LEFT, node.getBorderLeft(), "_bl", v, rank);
            addBorderNode(g, ctx, DummyKind.BORDER_RIGHT, node.getBorderRight(), "_br", v, rank);
        }
    }

    private static void addBorderNode(LayoutGraph g, LayoutContext ctx, DummyKind kind,
            Map<Integer, String> borders, String prefix, String cluster, int rank) {
        NodeLabel label = new NodeLabel();
        label.setRank(rank);
        String prev = borders.get(rank - 1);
        String curr = ctx.addDummyNode(g, kind, label, prefix);
        borders.put(rank, curr);
        g.setParent(curr, cluster);
        if (prev != null)
            g.setEdge(prev, curr, EdgeLabel.of(1, 1));
    }

    /**
     * Derives every cluster's box from its border nodes, then deletes all
     * border dummies.
     */
    public static void remove(LayoutGraph g) {
        for (String v : g.nodes()) {
            if (!g.hasChildren(v))
                continue;
            NodeLabel node = g.node(v);
            if (node.getBorderTop() == null || node.getBorderLeft() == null)
                continue;
            NodeLabel t = g.node(node.getBorderTop());
            NodeLabel b = g.node(node.getBorderBottom());
            NodeLabel l = g.node(node.getBorderLeft().get(node.getMaxRank()));
            NodeLabel r = g.node(node.getBorderRight().get(node.getMaxRank()));

            node.setWidth(Math.abs(r.getX() - l.getX()));
            node.setHeight(Math.abs(b.getY() - t.getY()));
            node.setX(l.getX() + node.getWidth() / 2);
            node.setY(t.getY() + node.getHeight() / 2);
        }

        for (String v : g.nodes()) {
            if (g.node(v).isBorder())
                g.removeNode(v);
        }
    }
}

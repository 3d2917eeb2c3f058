package com.graphdraw.lgl.selfedge;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.Layers;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;
import com.graphdraw.lgl.core.SelfEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Self-loops take no part in ranking or ordering. They are parked on their
 * owner node, come back as a dummy placed right of the owner so positioning
 * reserves room for them, and are finally drawn as a five-point loop around
 * that space.
 */
public final class SelfEdges {

    private SelfEdges() {
    }

    public static void remove(LayoutGraph g) {
        for (EdgeKey e : g.edges()) {
            if (!e.isSelfLoop())
                continue;
            g.node(e.v()).getSelfEdges().add(new SelfEdge(e, g.edge(e)));
            g.removeEdge(e);
        }
    }

    /**
     * Inserts one {@link DummyKind#SELF_EDGE} node per parked loop directly after
     * its owner, shifting the orders of the rest of the layer.
     */
    public static void insert(LayoutGraph g, LayoutContext ctx) {
        boolean horizontal = g.config().getDirection().isHorizontal();
        for (List<String> layer : Layers.buildLayerMatrix(g)) {
            int orderShift = 0;
            for (int i = 0; i < layer.size(); i++) {
                NodeLabel node = g.node(layer.get(i));
                node.setOrder(i + orderShift);
                for (SelfEdge selfEdge : node.getSelfEdges()) {
                    EdgeLabel label = selfEdge.label();
                    if (horizontal) {
                        double w = label.getWidth();
                        label.setWidth(label.getHeight());
                        label.setHeight(w);
                    }
                    NodeLabel dummy = NodeLabel.of(label.getWidth(), label.getHeight());
                    dummy.setRank(node.getRank());
                    dummy.setOrder(i + (++orderShift));
                    dummy.setEdgeObj(selfEdge.edge());
                    dummy.setEdgeLabel(label);
                    ctx.addDummyNode(g, DummyKind.SELF_EDGE, dummy, "_se");
                }
                node.setSelfEdges(new ArrayList<>());
            }
        }
    }

    /** Restores every loop with its points and removes the dummies. */
    public static void position(LayoutGraph g) {
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            if (node.getDummy() != DummyKind.SELF_EDGE)
                continue;
            NodeLabel selfNode = g.node(node.getEdgeObj().v());
            double x = selfNode.getX() + selfNode.getWidth() / 2;
            double y = selfNode.getY();
            double dx = node.getX() - x;
            double dy = selfNode.getHeight() / 2;

            EdgeLabel label = node.getEdgeLabel();
            g.setEdge(node.getEdgeObj(), label);
            g.removeNode(v);

            List<Point> points = new ArrayList<>(5);
            points.add(new Point(x + 2 * dx / 3, y - dy));
            points.add(new Point(x + 5 * dx / 6, y - dy));
            points.add(new Point(x + dx, y));
            points.add(new Point(x + 5 * dx / 6, y + dy));
            points.add(new Point(x + 2 * dx / 3, y + dy));
            label.setPoints(points);
            label.setX(node.getX());
            label.setY(node.getY());
        }
    }
}

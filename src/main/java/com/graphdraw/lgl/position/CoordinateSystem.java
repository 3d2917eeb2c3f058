package com.graphdraw.lgl.position;

import com.graphdraw.lgl.api.Direction;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.List;

/**
 * Maps between the configured drawing direction and the top-to-bottom
 * orientation positioning works in.
 *
 * {@link #adjust} swaps widths and heights for horizontal directions before
 * positioning. {@link #undo} mirrors y for bottom-up directions, then swaps the
 * axes back for horizontal ones.
 */
public final class CoordinateSystem {

    private CoordinateSystem() {
    }

    public static void adjust(LayoutGraph g) {
        if (g.config().getDirection().isHorizontal())
            swapWidthHeight(g);
    }

    public static void undo(LayoutGraph g) {
        Direction direction = g.config().getDirection();
        if (direction.isReversed())
            reverseY(g);
        if (direction.isHorizontal()) {
            swapXY(g);
            swapWidthHeight(g);
        }
    }

    private static void swapWidthHeight(LayoutGraph g) {
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            double w = node.getWidth();
            node.setWidth(node.getHeight());
            node.setHeight(w);
        }
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            double w = edge.getWidth();
            edge.setWidth(edge.getHeight());
            edge.setHeight(w);
        }
    }

    private static void reverseY(LayoutGraph g) {
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            if (node.getY() != null)
                node.setY(-node.getY());
        }
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            List<Point> points = edge.getPoints();
            for (int i = 0; i < points.size(); i++)
                points.set(i, new Point(points.get(i).x(), -points.get(i).y()));
            if (edge.getY() != null)
                edge.setY(-edge.getY());
        }
    }

    private static void swapXY(LayoutGraph g) {
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            Double x = node.getX();
            node.setX(node.getY());
            node.setY(x);
        }
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            List<Point> points = edge.getPoints();
            for (int i = 0; i < points.size(); i++)
                points.set(i, new Point(points.get(i).y(), points.get(i).x()));
            if (edge.getX() != null) {
                Double x = edge.getX();
                edge.setX(edge.getY());
                edge.setY(x);
            }
        }
    }
}

package com.graphdraw.lgl.finish;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.GraphConfig;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.List;

/**
 * Moves the drawing so its bounding box of nodes and label boxes starts at
 * ({@code marginx}, {@code marginy}), then records the drawing size on the
 * graph config. Edge waypoints are moved but do not count toward the box.
 */
public final class Translation {

    private Translation() {
    }

    public static void translate(LayoutGraph g) {
        GraphConfig config = g.config();
        double marginX = config.getMarginx();
        double marginY = config.getMarginy();

        Bounds bounds = new Bounds();
        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            if (node.hasPosition())
                bounds.include(node.getX(), node.getY(), node.getWidth(), node.getHeight());
        }
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            if (edge.getX() != null && edge.getY() != null)
                bounds.include(edge.getX(), edge.getY(), edge.getWidth(), edge.getHeight());
        }
        if (bounds.isEmpty()) {
            config.setWidth(2 * marginX);
            config.setHeight(2 * marginY);
            return;
        }

        double dx = marginX - bounds.minX;
        double dy = marginY - bounds.minY;

        for (String v : g.nodes()) {
            NodeLabel node = g.node(v);
            if (node.hasPosition()) {
                node.setX(node.getX() + dx);
                node.setY(node.getY() + dy);
            }
        }
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            List<Point> points = edge.getPoints();
            for (int i = 0; i < points.size(); i++)
                points.set(i, new Point(points.get(i).x() + dx, points.get(i).y() + dy));
            if (edge.getX() != null)
                edge.setX(edge.getX() + dx);
            if (edge.getY() != null)
                edge.setY(edge.getY() + dy);
        }

        config.setWidth(bounds.maxX - bounds.minX + 2 * marginX);
        config.setHeight(bounds.maxY - bounds.minY + 2 * marginY);
    }

    private static final class Bounds {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        void include(double x, double y, double w, double h) {
            minX = Math.min(minX, x - w / 2);
            maxX = Math.max(maxX, x + w / 2);
            minY = Math.min(minY, y - h / 2);
            maxY = Math.max(maxY, y + h / 2);
        }

        boolean isEmpty() {
            return minX == Double.POSITIVE_INFINITY;
        }
    }
}

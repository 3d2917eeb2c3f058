package com.graphdraw.lgl.finish;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.List;

/**
 * Completes every edge's waypoint list so it starts and ends on the boundary
 * of its end nodes.
 */
public final class EdgeIntersections {

    private EdgeIntersections() {
    }

    public static void assignNodeIntersects(LayoutGraph g) {
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            NodeLabel nodeV = g.node(e.v());
            NodeLabel nodeW = g.node(e.w());
            List<Point> points = edge.getPoints();
            Point p1;
            Point p2;
            if (points.isEmpty()) {
                Point mid = new Point((nodeV.getX() + nodeW.getX()) / 2, (nodeV.getY() + nodeW.getY()) / 2);
                points.add(mid);
                p1 = mid;
                p2 = mid;
            } else {
                p1 = points.get(0);
                p2 = points.get(points.size() - 1);
            }
            points.add(0, intersectRect(nodeV, p1));
            points.add(intersectRect(nodeW, p2));
        }
    }

    /**
     * Point where the segment from the centre of {@code node} towards
     * {@code point} leaves the node's rectangle. A point at the centre yields
     * the middle of the right side.
     */
    public static Point intersectRect(NodeLabel node, Point point) {
        double x = node.getX();
        double y = node.getY();
        double dx = point.x() - x;
        double dy = point.y() - y;
        double w = node.getWidth() / 2;
        double h = node.getHeight() / 2;

        if (dx == 0 && dy == 0)
            return new Point(x + w, y);

        double sx;
        double sy;
        if (Math.abs(dy) * w > Math.abs(dx) * h) {
            if (dy < 0)
                h = -h;
            sx = h * dx / dy;
            sy = h;
        } else {
            if (dx < 0)
                w = -w;
            sx = w;
            sy = w * dy / dx;
        }
        return new Point(x + sx, y + sy);
    }
}

package com.graphdraw.lgl.engine;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.ArrayList;

/**
 * Moves a caller's graph into a private layout graph and copies the results
 * back, so a failed run never leaves the caller's graph half-written.
 */
public final class LayoutGraphAdapter {

    private LayoutGraphAdapter() {
    }

    /**
     * Builds the compound multigraph the pipeline works on, holding copies of
     * the layout-relevant attributes of {@code input}.
     *
     * @throws IllegalArgumentException if a size, minlen or weight is out of range,
     *                                  an edge has no label position, or an edge
     *                                  ends on a cluster.
     */
    public static LayoutGraph toLayoutGraph(LayoutGraph input) {
        LayoutGraph g = new LayoutGraph(true, true);
        g.setGraph(input.config().copy());

        for (String v : input.nodes()) {
            NodeLabel in = input.node(v);
            if (in == null)
                throw new IllegalArgumentException("No label for node: " + v);
            checkSize("node " + v, in.getWidth(), in.getHeight());
            g.setNode(v, NodeLabel.of(in.getWidth(), in.getHeight()));
        }
        if (input.isCompound()) {
            for (String v : input.nodes()) {
                String parent = input.parent(v);
                if (parent != null)
                    g.setParent(v, parent);
            }
        }
        for (EdgeKey e : input.edges()) {
            EdgeLabel in = input.edge(e);
            if (input.hasChildren(e.v()) || input.hasChildren(e.w()))
                throw new IllegalArgumentException("Edge " + e + " ends on a cluster");
            if (in.getMinlen() < 1)
                throw new IllegalArgumentException("Edge " + e + " has minlen " + in.getMinlen() + " < 1");
            if (!(in.getWeight() >= 0) || Double.isInfinite(in.getWeight()))
                throw new IllegalArgumentException("Edge " + e + " has invalid weight " + in.getWeight());
            checkSize("edge " + e, in.getWidth(), in.getHeight());
            if (in.getLabelpos() == null)
                throw new IllegalArgumentException("Edge " + e + " has no label position");
            g.setEdge(e, in.copyAttributes());
        }
        return g;
    }

    /** Writes positions, cluster sizes, edge geometry and drawing size back onto {@code input}. */
    public static void copyBack(LayoutGraph layout, LayoutGraph input) {
        checkComplete(layout, input);
        for (String v : input.nodes()) {
            NodeLabel out = input.node(v);
            NodeLabel result = layout.node(v);
            out.setX(result.getX());
            out.setY(result.getY());
            out.setRank(result.getRank());
            out.setOrder(result.getOrder());
            if (layout.hasChildren(v)) {
                out.setWidth(result.getWidth());
                out.setHeight(result.getHeight());
            }
        }
        for (EdgeKey e : input.edges()) {
            EdgeLabel out = input.edge(e);
            EdgeLabel result = layout.edge(e);
            out.setPoints(new ArrayList<>(result.getPoints()));
            out.setX(result.getX());
            out.setY(result.getY());
        }
        input.config().setWidth(layout.config().getWidth());
        input.config().setHeight(layout.config().getHeight());
    }

    /** Nothing is written unless every node and edge of {@code input} has a result. */
    private static void checkComplete(LayoutGraph layout, LayoutGraph input) {
        for (String v : input.nodes()) {
            if (layout.node(v) == null)
                throw new IllegalStateException("No layout result for node: " + v);
        }
        for (EdgeKey e : input.edges()) {
            if (layout.edge(e) == null)
                throw new IllegalStateException("No layout result for edge: " + e);
        }
    }

    private static void checkSize(String what, double width, double height) {
        if (!(width >= 0) || !(height >= 0) || Double.isInfinite(width) || Double.isInfinite(height))
            throw new IllegalArgumentException("Invalid size for " + what + ": " + width + "x" + height);
    }
}

package com.graphdraw.lgl.position;

import com.graphdraw.lgl.core.Graphs;
import com.graphdraw.lgl.core.Layers;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.List;
import java.util.Map;

/**
 * Assigns centre coordinates to every leaf node (real and dummy) of a ranked,
 * ordered graph. Y comes from the rank heights, x from {@link BrandesKoepf}.
 * Clusters are positioned later from their border nodes.
 */
public final class Positioner {

    private Positioner() {
    }

    public static void position(LayoutGraph g) {
        LayoutGraph leaves = Graphs.asNonCompound(g);
        positionY(leaves);
        for (Map.Entry<String, Double> e : BrandesKoepf.positionX(leaves).entrySet())
            leaves.node(e.getKey()).setX(e.getValue());
    }

    /** Each rank is as tall as its tallest node; ranks are {@code ranksep} apart. */
    static void positionY(LayoutGraph g) {
        double rankSep = g.config().getRanksep();
        double prevY = 0;
        for (List<String> layer : Layers.buildLayerMatrix(g)) {
            double maxHeight = 0;
            for (String v : layer)
                maxHeight = Math.max(maxHeight, g.node(v).getHeight());
            for (String v : layer) {
                NodeLabel node = g.node(v);
                node.setY(prevY + maxHeight / 2);
            }
            prevY += maxHeight + rankSep;
        }
    }
}

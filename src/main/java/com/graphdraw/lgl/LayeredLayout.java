package com.graphdraw.lgl;

import com.graphdraw.lgl.api.LayoutListener;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.engine.LayoutGraphAdapter;
import com.graphdraw.lgl.engine.LayoutPipeline;

/**
 * Entry point: assigns coordinates to the nodes and waypoints to the edges of
 * a directed graph, drawn in ranks along the configured direction.
 *
 * <pre>
 * LayoutGraph g = new LayoutGraph();
 * g.setNode("a", NodeLabel.of(40, 20));
 * g.setNode("b", NodeLabel.of(40, 20));
 * g.setEdge("a", "b");
 * LayeredLayout.layout(g);
 * double x = g.node("a").getX();
 * </pre>
 *
 * The input graph is read, laid out on a private copy, and only written to
 * once the whole run succeeded.
 */
public final class LayeredLayout {

    private LayeredLayout() {
    }

    public static void layout(LayoutGraph graph) {
        layout(graph, null);
    }

    /**
     * @param listener Optional tracing callback, may be null.
     * @throws IllegalArgumentException                  if the graph is malformed.
     * @throws com.graphdraw.lgl.engine.LayoutException if a stage fails.
     */
    public static void layout(LayoutGraph graph, LayoutListener listener) {
        LayoutGraph layoutGraph = LayoutGraphAdapter.toLayoutGraph(graph);
        new LayoutPipeline(listener).run(layoutGraph);
        LayoutGraphAdapter.copyBack(layoutGraph, graph);
    }
}

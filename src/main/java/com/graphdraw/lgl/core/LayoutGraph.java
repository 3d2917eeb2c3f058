package com.graphdraw.lgl.core;

/**
 * The graph type the layout works on: {@link GraphConfig} as graph label,
 * {@link NodeLabel} and {@link EdgeLabel} as element labels.
 *
 * Edges get a fresh {@link EdgeLabel} when none is given. Nodes must be added
 * explicitly unless {@link #setDefaultNodeLabel} is installed.
 */
public class LayoutGraph extends Graph<GraphConfig, NodeLabel, EdgeLabel> {

    /** Compound multigraph. */
    public LayoutGraph() {
        this(true, true);
    }

    public LayoutGraph(boolean multigraph, boolean compound) {
        super(multigraph, compound);
        setGraph(new GraphConfig());
        setDefaultEdgeLabel(EdgeLabel::new);
    }

    public GraphConfig config() {
        return graph();
    }

    @Override
    public LayoutGraph copy() {
        LayoutGraph g = new LayoutGraph(isMultigraph(), isCompound());
        copyInto(g);
        return g;
    }
}

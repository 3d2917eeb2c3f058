package com.graphdraw.lgl.util;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.Layers;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.List;

/**
 * Human-readable dumps of a layout graph, for debugging sessions and error
 * reports. Not meant for anything performance sensitive.
 */
public final class LayoutExplain {
    private final LayoutGraph graph;

    public LayoutExplain(LayoutGraph graph) {
        this.graph = graph;
    }

    /** Ranks with their nodes in order; dummies are tagged with their kind. */
    public String explainLayers() {
        StringBuilder sb = new StringBuilder(512);
        List<List<String>> layers = Layers.buildLayerMatrix(graph);
        for (int rank = 0; rank < layers.size(); rank++) {
            sb.append(String.format("rank %3d:", rank));
            for (String v : layers.get(rank)) {
                sb.append(' ').append(v);
                NodeLabel label = graph.node(v);
                if (label.isDummy())
                    sb.append('[').append(label.getDummy()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String explainNode(String v) {
        NodeLabel node = graph.node(v);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + v);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(v).append('\n')
                .append("  Kind: ").append(node.isDummy() ? node.getDummy() : "NODE").append('\n')
                .append("  Parent: ").append(graph.parent(v)).append('\n')
                .append("  Rank/order: ").append(node.getRank()).append('/').append(node.getOrder()).append('\n')
                .append("  Size: ").append(node.getWidth()).append('x').append(node.getHeight()).append('\n')
                .append("  Position: ").append(node.getX()).append(", ").append(node.getY()).append('\n');
        if (graph.hasChildren(v))
            sb.append("  Children: ").append(String.join(", ", graph.children(v))).append('\n');
        List<String> out = graph.successors(v);
        sb.append("  Successors (").append(out.size()).append("): ").append(String.join(", ", out)).append('\n');
        return sb.toString();
    }

    public String explainEdge(EdgeKey e) {
        EdgeLabel edge = graph.edge(e);
        if (edge == null)
            throw new IllegalArgumentException("Unknown edge: " + e);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Edge: ").append(e).append('\n')
                .append("  minlen/weight: ").append(edge.getMinlen()).append('/').append(edge.getWeight()).append('\n');
        if (edge.hasLabelBox())
            sb.append("  Label: ").append(edge.getWidth()).append('x').append(edge.getHeight())
                    .append(" at ").append(edge.getX()).append(", ").append(edge.getY()).append('\n');
        sb.append("  Points:");
        for (Point p : edge.getPoints())
            sb.append(String.format(" (%.1f, %.1f)", p.x(), p.y()));
        return sb.append('\n').toString();
    }

    /** Graph summary followed by every layer. */
    public String explainGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("=== Layout Graph ===\n")
                .append("Direction: ").append(graph.config().getDirection()).append('\n')
                .append("Nodes: ").append(graph.nodeCount()).append(", Edges: ").append(graph.edgeCount()).append('\n')
                .append(String.format("Size: %.1f x %.1f%n", graph.config().getWidth(), graph.config().getHeight()));
        sb.append(explainLayers());
        return sb.toString();
    }
}

package com.graphdraw.lgl.nesting;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Scaffolding that lets network simplex rank a compound graph.
 *
 * Every cluster gets a top and a bottom border node. Weighted nesting edges
 * run from the top border through each child down to the bottom border, which
 * keeps children between their cluster's borders and pulls the cluster
 * vertically tight. A synthetic root is connected to every leaf and to every
 * top-level cluster, so the graph handed to the ranker is always connected.
 *
 * Original edge minlens are scaled by {@code 2 * height + 1} so that border
 * nodes can sit on the ranks in between. The scale is remembered as the node
 * rank factor; empty in-between ranks are dropped again after ranking.
 *
 * Also run on flat graphs, where it only adds the root connectors.
 */
@Log4j2
public final class NestingGraph {

    private NestingGraph() {
    }

    public static void run(LayoutGraph g, LayoutContext ctx) {
        String root = ctx.addDummyNode(g, DummyKind.NESTING_ROOT, new NodeLabel(), "_root");
        Map<String, Integer> depths = treeDepths(g);
        int maxDepth = 0;
        for (int depth : depths.values())
            maxDepth = Math.max(maxDepth, depth);
        int height = maxDepth - 1;
        int nodeSep = 2 * height + 1;

        ctx.setNestingRoot(root);

        double weight = 1;
        for (EdgeKey e : g.edges()) {
            EdgeLabel label = g.edge(e);
            label.setMinlen(label.getMinlen() * nodeSep);
            weight += label.getWeight();
        }

        for (String child : g.children(null))
            dfs(g, ctx, root, nodeSep, weight, height, depths, child);

        ctx.setNodeRankFactor(nodeSep);
        log.debug("Nesting graph: height={}, nodeSep={}", height, nodeSep);
    }

    private static void dfs(LayoutGraph g, LayoutContext ctx, String root, int nodeSep, double weight,
            int height, Map<String, Integer> depths, String v) {
        List<String> children = g.children(v);
        if (children.isEmpty()) {
            if (!v.equals(root))
                g.setEdge(root, v, nestingEdge(0, nodeSep, false));
            return;
        }

        String top = ctx.addDummyNode(g, DummyKind.BORDER_TOP, new NodeLabel(), "_bt");
        String bottom = ctx.addDummyNode(g, DummyKind.BORDER_BOTTOM, new NodeLabel(), "_bb");
        NodeLabel label = g.node(v);
        g.setParent(top, v);
        label.setBorderTop(top);
        g.setParent(bottom, v);
        label.setBorderBottom(bottom);

        for (String child : children) {
            dfs(g, ctx, root, nodeSep, weight, height, depths, child);

            NodeLabel childNode = g.node(child);
            String childTop = childNode.getBorderTop() != null ? childNode.getBorderTop() : child;
            String childBottom = childNode.getBorderBottom() != null ? childNode.getBorderBottom() : child;
            double thisWeight = childNode.getBorderTop() != null ? weight : 2 * weight;
            int minlen = !childTop.equals(childBottom) ? 1 : height - depths.get(v) + 1;

            g.setEdge(top, childTop, nestingEdge(thisWeight, minlen, true));
            g.setEdge(childBottom, bottom, nestingEdge(thisWeight, minlen, true));
        }

        if (g.parent(v) == null)
            g.setEdge(root, top, nestingEdge(0, height + depths.get(v), false));
    }

    private static EdgeLabel nestingEdge(double weight, int minlen, boolean nesting) {
        EdgeLabel label = EdgeLabel.of(minlen, weight);
        label.setNestingEdge(nesting);
        return label;
    }

    /** Depth of every node in the cluster hierarchy, top-level nodes at 1. */
    private static Map<String, Integer> treeDepths(LayoutGraph g) {
        Map<String, Integer> depths = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String v : g.children(null)) {
            depths.put(v, 1);
            stack.push(v);
        }
        while (!stack.isEmpty()) {
            String v = stack.pop();
            int depth = depths.get(v);
            for (String child : g.children(v)) {
                depths.put(child, depth + 1);
                stack.push(child);
            }
        }
        return depths;
    }

    /**
     * Removes the root and the nesting edges. Border nodes stay: they carry the
     * cluster's rank span and later its geometry.
     */
    public static void cleanup(LayoutGraph g, LayoutContext ctx) {
        g.removeNode(ctx.nestingRoot());
        ctx.setNestingRoot(null);
        for (EdgeKey e : g.edges()) {
            if (g.edge(e).isNestingEdge())
                g.removeEdge(e);
        }
    }
}

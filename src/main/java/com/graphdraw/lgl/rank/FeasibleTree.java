package com.graphdraw.lgl.rank;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Grows a spanning tree of tight edges from an initial feasible ranking.
 *
 * Starting from the first node, the tree absorbs every node reachable over
 * tight edges. When it stops growing, the non-tree edge with the least slack
 * that touches the tree is made tight by shifting the whole tree, and growing
 * resumes. The graph's ranks are modified along the way and stay feasible.
 */
public final class FeasibleTree {

    private FeasibleTree() {
    }

    public static SpanningTree find(LayoutGraph g) {
        SpanningTree t = new SpanningTree();
        if (g.nodeCount() == 0)
            return t;
        t.addNode(g.nodes().get(0));
        int size = g.nodeCount();
        while (tightTree(t, g) < size) {
            EdgeKey edge = findMinSlackEdge(t, g);
            if (edge == null)
                throw new IllegalStateException(
                        "Cannot grow a feasible tree: graph is not connected (" + t.nodeCount() + " of " + size + " nodes reached)");
            int delta = t.hasNode(edge.v()) ? RankUtil.slack(g, edge) : -RankUtil.slack(g, edge);
            for (String v : t.nodes())
                g.node(v).setRank(g.node(v).getRank() + delta);
        }
        return t;
    }

    private static int tightTree(SpanningTree t, LayoutGraph g) {
        Deque<String> nodes = new ArrayDeque<>();
        Deque<Iterator<EdgeKey>> edges = new ArrayDeque<>();
        for (String start : t.nodes()) {
            nodes.push(start);
            edges.push(g.nodeEdges(start).iterator());
            while (!edges.isEmpty()) {
                Iterator<EdgeKey> it = edges.peek();
                if (!it.hasNext()) {
                    edges.pop();
                    nodes.pop();
                    continue;
                }
                EdgeKey e = it.next();
                String v = nodes.peek();
                String w = e.other(v);
                if (!t.hasNode(w) && RankUtil.slack(g, e) == 0) {
                    t.addEdge(v, w);
                    nodes.push(w);
                    edges.push(g.nodeEdges(w).iterator());
                }
            }
        }
        return t.nodeCount();
    }

    private static EdgeKey findMinSlackEdge(SpanningTree t, LayoutGraph g) {
        EdgeKey best = null;
        int bestSlack = Integer.MAX_VALUE;
        for (EdgeKey e : g.edges()) {
            if (t.hasNode(e.v()) == t.hasNode(e.w()))
                continue;
            int slack = RankUtil.slack(g, e);
            if (slack < bestSlack || (slack == bestSlack && e.compareTo(best) < 0)) {
                best = e;
                bestSlack = slack;
            }
        }
        return best;
    }
}

package com.graphdraw.lgl.compound;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves the dummies of each normalized edge into the clusters the edge passes
 * through.
 *
 * The cluster path of an edge climbs from the tail's cluster up to the lowest
 * common ancestor and descends to the head's cluster. Walking the chain rank
 * by rank, each dummy is parented to the deepest cluster on that path whose
 * rank span covers the dummy's rank.
 */
public final class ParentDummyChains {

    private record Span(int low, int lim) {
    }

    private record ClusterPath(List<String> path, String lca) {
    }

    private ParentDummyChains() {
    }

    public static void run(LayoutGraph g, LayoutContext ctx) {
        Map<String, Span> postorderNums = postorder(g);

        for (String start : ctx.dummyChains()) {
            String v = start;
            EdgeKey edgeObj = g.node(v).getEdgeObj();
            ClusterPath pathData = findPath(g, postorderNums, edgeObj.v(), edgeObj.w());
            List<String> path = pathData.path();
            String lca = pathData.lca();
            int pathIdx = 0;
            String pathV = path.get(pathIdx);
            boolean ascending = true;

            while (!v.equals(edgeObj.w())) {
                NodeLabel node = g.node(v);
                int rank = node.getRank();

                if (ascending) {
                    while (!Objects.equals(pathV = path.get(pathIdx), lca)
                            && g.node(pathV).getMaxRank() < rank) {
                        pathIdx++;
                    }
                    if (Objects.equals(pathV, lca))
                        ascending = false;
                }

                if (!ascending) {
                    while (pathIdx < path.size() - 1
                            && g.node(path.get(pathIdx + 1)).getMinRank() <= rank) {
                        pathIdx++;
                    }
                    pathV = path.get(pathIdx);
                }

                g.setParent(v, pathV);
                v = g.successors(v).get(0);
            }
        }
    }

    /**
     * Clusters from the parent of {@code v} up to the lowest common ancestor,
     * then down to the parent of {@code w}. A null entry stands for the top
     * level.
     */
    private static ClusterPath findPath(LayoutGraph g, Map<String, Span> postorderNums, String v, String w) {
        List<String> vPath = new ArrayList<>();
        List<String> wPath = new ArrayList<>();
        int low = Math.min(postorderNums.get(v).low(), postorderNums.get(w).low());
        int lim = Math.max(postorderNums.get(v).lim(), postorderNums.get(w).lim());

        String parent = v;
        do {
            parent = g.parent(parent);
            vPath.add(parent);
        } while (parent != null
                && (postorderNums.get(parent).low() > low || lim > postorderNums.get(parent).lim()));
        String lca = parent;

        parent = w;
        while (!Objects.equals(parent = g.parent(parent), lca))
            wPath.add(parent);
        Collections.reverse(wPath);
        vPath.addAll(wPath);
        return new ClusterPath(vPath, lca);
    }

    /** Post-order numbering of the cluster hierarchy. */
    private static Map<String, Span> postorder(LayoutGraph g) {
        Map<String, Span> result = new HashMap<>();
        int lim = 0;
        Deque<String> nodes = new ArrayDeque<>();
        Deque<Integer> lows = new ArrayDeque<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        for (String top : g.children(null)) {
            nodes.push(top);
            lows.push(lim);
            stack.push(g.children(top).iterator());
            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (it.hasNext()) {
                    String child = it.next();
                    nodes.push(child);
                    lows.push(lim);
                    stack.push(g.children(child).iterator());
                } else {
                    stack.pop();
                    result.put(nodes.pop(), new Span(lows.pop(), lim++));
                }
            }
        }
        return result;
    }
}

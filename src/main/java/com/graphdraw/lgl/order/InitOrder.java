package com.graphdraw.lgl.order;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.Graphs;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Initial order: a depth-first walk along out-edges, started from the leaf
 * nodes in rank order, appends every node to its rank as it is reached.
 *
 * Each rank is then regrouped, keeping first-seen order, so that the members
 * of a cluster are contiguous and its left and right borders sit at the ends.
 */
final class InitOrder {

    private InitOrder() {
    }

    static List<List<String>> initOrder(LayoutGraph g) {
        List<String> simpleNodes = g.filterNodes(v -> !g.hasChildren(v) && g.node(v).getRank() != null);
        int maxRank = -1;
        for (String v : simpleNodes)
            maxRank = Math.max(maxRank, g.node(v).getRank());

        List<List<String>> layers = new ArrayList<>();
        for (int i = 0; i <= maxRank; i++)
            layers.add(new ArrayList<>());

        List<String> ordered = new ArrayList<>(simpleNodes);
        ordered.sort((a, b) -> Integer.compare(g.node(a).getRank(), g.node(b).getRank()));
        for (String v : Graphs.preorder(g, ordered)) {
            Integer rank = g.node(v).getRank();
            if (rank != null)
                layers.get(rank).add(v);
        }

        if (g.isCompound()) {
            for (int i = 0; i < layers.size(); i++)
                layers.set(i, groupByCluster(g, layers.get(i), 0));
        }
        return layers;
    }

    private static List<String> groupByCluster(LayoutGraph g, List<String> vs, int depth) {
        if (vs.size() <= 1)
            return vs;
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String v : vs) {
            List<String> chain = ancestry(g, v);
            String key = depth < chain.size() ? chain.get(depth) : v;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(v);
        }

        List<String> result = new ArrayList<>(vs.size());
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            List<String> members = group.getValue();
            if (members.size() == 1) {
                result.addAll(members);
                continue;
            }
            List<String> sub = new ArrayList<>(groupByCluster(g, members, depth + 1));
            moveBorders(g, group.getKey(), sub);
            result.addAll(sub);
        }
        return result;
    }

    private static void moveBorders(LayoutGraph g, String cluster, List<String> members) {
        String left = null;
        String right = null;
        for (String v : members) {
            NodeLabel node = g.node(v);
            if (!cluster.equals(g.parent(v)))
                continue;
            if (node.getDummy() == DummyKind.BORDER_LEFT)
                left = v;
            else if (node.getDummy() == DummyKind.BORDER_RIGHT)
                right = v;
        }
        if (left != null) {
            members.remove(left);
            members.add(0, left);
        }
        if (right != null) {
            members.remove(right);
            members.add(right);
        }
    }

    /** Cluster ancestors from the top level down, followed by {@code v}. */
    private static List<String> ancestry(LayoutGraph g, String v) {
        List<String> chain = new ArrayList<>();
        for (String a = v; a != null; a = g.parent(a))
            chain.add(a);
        Collections.reverse(chain);
        return chain;
    }
}
